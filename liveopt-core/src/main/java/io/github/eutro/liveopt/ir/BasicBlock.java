package io.github.eutro.liveopt.ir;

import io.github.eutro.liveopt.ext.CommonExts;
import io.github.eutro.liveopt.ext.ExtHolder;
import io.github.eutro.liveopt.ext.TrackedList;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A basic block: a list of {@link Insn instructions} followed by exactly one {@link Control control transfer}.
 * <p>
 * Blocks are created by {@link Cfg#newBlock(int)}, and are identified by their index within it.
 * Changing the instructions or the control transfer invalidates the metadata of the owning graph.
 */
public final class BasicBlock extends ExtHolder {
    private final Cfg owner;
    private final int index;
    private final List<Insn> insns = new TrackedList<Insn>(new ArrayList<>()) {
        @Override
        protected void onAdded(Insn elt) {
            Objects.requireNonNull(elt);
            owner.getExtOrThrow(CommonExts.METADATA_STATE).insnsChanged();
        }

        @Override
        protected void onRemoved(Insn elt) {
            owner.getExtOrThrow(CommonExts.METADATA_STATE).insnsChanged();
        }
    };
    private Control next = Control.end();

    BasicBlock(Cfg owner, int index) {
        this.owner = owner;
        this.index = index;
    }

    public int getIndex() {
        return index;
    }

    /**
     * Get the graph this block is in.
     *
     * @return The owning graph.
     */
    public Cfg getOwner() {
        return owner;
    }

    /**
     * Get the mutable list of instructions in this block, in execution order.
     *
     * @return The list.
     */
    public List<Insn> getInsns() {
        return insns;
    }

    /**
     * Add an instruction to the end of this block.
     *
     * @param insn The instruction.
     */
    public void addInsn(Insn insn) {
        insns.add(insn);
    }

    public Control getNext() {
        return next;
    }

    /**
     * Set the control transfer of this block.
     * <p>
     * Targets are not checked until the graph is {@link io.github.eutro.liveopt.passes.meta.VerifyIntegrity verified}
     * or its predecessors are computed.
     *
     * @param next The control transfer.
     */
    public void setNext(Control next) {
        this.next = Objects.requireNonNull(next);
        owner.getExtOrThrow(CommonExts.METADATA_STATE).graphChanged();
    }

    /**
     * Format this block as a jump target, for debugging.
     *
     * @return The jump target string.
     */
    public String toTargetString() {
        return "block " + index;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString()).append(" {\n");
        for (Insn insn : insns) {
            sb.append("  ").append(insn).append('\n');
        }
        sb.append("  ").append(next);
        sb.append("\n}");
        return sb.toString();
    }
}
