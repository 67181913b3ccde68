/**
 * The intermediate representation (IR) the passes operate on.
 * <p>
 * A {@link io.github.eutro.liveopt.ir.Cfg} is a list of
 * {@link io.github.eutro.liveopt.ir.BasicBlock basic blocks}, each a straight-line list of
 * {@link io.github.eutro.liveopt.ir.Insn instructions} ending in a single
 * {@link io.github.eutro.liveopt.ir.Control control transfer} to other blocks, named by index.
 * <p>
 * Values are named by non-negative integer identifiers. The IR is not in SSA form:
 * an identifier may be written any number of times, in any number of blocks.
 * Memory is accessed only through {@link io.github.eutro.liveopt.ir.Insn.Load loads} and
 * {@link io.github.eutro.liveopt.ir.Insn.Store stores}, and is never aliased with an identifier.
 * <p>
 * Analysis results are not fields of the IR, but {@link io.github.eutro.liveopt.ext.Ext exts}
 * attached to it by {@link io.github.eutro.liveopt.passes passes}.
 */
package io.github.eutro.liveopt.ir;
