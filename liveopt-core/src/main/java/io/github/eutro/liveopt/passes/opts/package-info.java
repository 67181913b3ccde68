/**
 * {@link io.github.eutro.liveopt.passes.IRPass IR passes} that perform optimisations.
 * <p>
 * They never change the observable behaviour of a graph, only remove work from it.
 */
package io.github.eutro.liveopt.passes.opts;
