package io.github.eutro.liveopt.passes.meta;

import io.github.eutro.liveopt.ext.CommonExts;
import io.github.eutro.liveopt.ext.CommonExts.LiveData;
import io.github.eutro.liveopt.ir.BasicBlock;
import io.github.eutro.liveopt.ir.IdentSet;
import io.github.eutro.liveopt.ir.Insn;
import io.github.eutro.liveopt.ir.OperandPolicy;
import io.github.eutro.liveopt.passes.InPlaceIRPass;

import java.util.List;
import java.util.ListIterator;

/**
 * Computes the gen and kill sets of a single block, attaching them as a fresh
 * {@link CommonExts#LIVE_DATA} with an empty live exit set.
 * <p>
 * This only looks at the block itself. The live exit set is filled in by {@link ComputeLiveVars}.
 */
public class ComputeLocalLiveness implements InPlaceIRPass<BasicBlock> {
    /**
     * An instance of this pass, using the {@link OperandPolicy#DEFAULT default policy}.
     */
    public static final ComputeLocalLiveness INSTANCE = new ComputeLocalLiveness(OperandPolicy.DEFAULT);

    private final OperandPolicy policy;

    public ComputeLocalLiveness(OperandPolicy policy) {
        this.policy = policy;
    }

    @Override
    public void runInPlace(BasicBlock block) {
        block.attachExt(CommonExts.LIVE_DATA, analyse(block, policy));
    }

    /**
     * Compute the gen and kill sets of a block.
     * <p>
     * The block is scanned from its last instruction to its first. A write removes its
     * destination from gen <i>before</i> adding what it reads, so that {@code x := x + 1}
     * still reads {@code x}, but an earlier read of {@code x} is not hidden by a later write.
     *
     * @param block  The block.
     * @param policy Whether address operands and branch conditions are reads.
     * @return The live data, with an empty live exit set.
     */
    public static LiveData analyse(BasicBlock block, OperandPolicy policy) {
        IdentSet gen = new IdentSet();
        IdentSet kill = new IdentSet();
        block.getNext().addReadsTo(gen, policy);

        List<Insn> insns = block.getInsns();
        for (ListIterator<Insn> li = insns.listIterator(insns.size()); li.hasPrevious(); ) {
            Insn insn = li.previous();
            if (insn.hasDest()) {
                int dest = insn.dest();
                kill.add(dest);
                gen.remove(dest);
            }
            insn.addReadsTo(gen, policy);
        }
        return new LiveData(gen, kill);
    }

    @Override
    public String toString() {
        return "ComputeLocalLiveness(" + policy + ")";
    }
}
