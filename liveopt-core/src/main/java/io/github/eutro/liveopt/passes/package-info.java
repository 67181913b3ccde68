/**
 * The {@link io.github.eutro.liveopt.passes.IRPass pass} framework, and {@link io.github.eutro.liveopt.passes.Passes
 * pre-composed pipelines}.
 * <p>
 * Passes compute their prerequisites on demand through the graph's
 * {@link io.github.eutro.liveopt.ext.MetadataState}, and invalidate whatever they change.
 */
package io.github.eutro.liveopt.passes;
