package io.github.eutro.liveopt.ir;

import static io.github.eutro.liveopt.ir.AtomicExp.ident;

/**
 * An instruction builder, which encapsulates a position in a {@link Cfg}
 * where instructions are being appended.
 */
public class CfgBuilder {
    /**
     * The graph being built.
     */
    public final Cfg cfg;
    private BasicBlock bb;

    /**
     * Construct a builder for a new, empty graph.
     */
    public CfgBuilder() {
        this(new Cfg());
    }

    /**
     * Construct a builder for an existing graph, with no current block.
     *
     * @param cfg The graph.
     */
    public CfgBuilder(Cfg cfg) {
        this.cfg = cfg;
    }

    /**
     * Create a new block, and start appending to it.
     *
     * @param index The index of the new block.
     * @return This builder.
     */
    public CfgBuilder block(int index) {
        bb = cfg.newBlock(index);
        return this;
    }

    /**
     * Get the block this builder is appending to.
     *
     * @return The block.
     */
    public BasicBlock getBlock() {
        if (bb == null) throw new IllegalStateException("no current block");
        return bb;
    }

    public void setBlock(BasicBlock bb) {
        this.bb = bb;
    }

    /**
     * Append an instruction to the current block.
     *
     * @param insn The instruction.
     * @return This builder.
     */
    public CfgBuilder insert(Insn insn) {
        getBlock().addInsn(insn);
        return this;
    }

    public CfgBuilder assign(int dest, AtomicExp src) {
        return insert(Insn.assignAtom(dest, src));
    }

    public CfgBuilder assign(int dest, AtomicExp lhs, BinOp op, AtomicExp rhs) {
        return insert(Insn.assignOp(dest, lhs, op, rhs));
    }

    public CfgBuilder load(int dest, AtomicExp addr) {
        return insert(Insn.load(dest, addr));
    }

    public CfgBuilder store(int value, AtomicExp addr) {
        return insert(Insn.store(value, addr));
    }

    public CfgBuilder input(int dest) {
        return insert(Insn.input(dest));
    }

    public CfgBuilder output(int value) {
        return insert(Insn.output(value));
    }

    /**
     * Copy one identifier into another, {@code dest := src}.
     *
     * @param dest The destination identifier.
     * @param src  The source identifier.
     * @return This builder.
     */
    public CfgBuilder copy(int dest, int src) {
        return assign(dest, ident(src));
    }

    /**
     * End the current block with an {@link Control#end() end} transfer.
     *
     * @return This builder.
     */
    public CfgBuilder end() {
        getBlock().setNext(Control.end());
        return this;
    }

    /**
     * End the current block with a jump to {@code target}.
     *
     * @param target The target index.
     * @return This builder.
     */
    public CfgBuilder jump(int target) {
        getBlock().setNext(Control.next(target));
        return this;
    }

    /**
     * End the current block with a branch on {@code cond}.
     *
     * @param cond    The condition identifier.
     * @param ifTrue  The target index if {@code cond} is true.
     * @param ifFalse The target index otherwise.
     * @return This builder.
     */
    public CfgBuilder branch(int cond, int ifTrue, int ifFalse) {
        getBlock().setNext(Control.branch(cond, ifTrue, ifFalse));
        return this;
    }

    /**
     * Get the built graph.
     *
     * @return The graph.
     */
    public Cfg build() {
        return cfg;
    }
}
