/**
 * The ext API allows for associating arbitrary data with
 * instances of {@link io.github.eutro.liveopt.ext.ExtContainer}.
 *
 * <pre>{@code
 * BasicBlock block = cfg.newBlock(0);
 * ComputeLocalLiveness.INSTANCE.runInPlace(block);
 * block.getExtOrThrow(CommonExts.LIVE_DATA).gen; // => {}
 * }</pre>
 * <p>
 * Analyses attach their results to the IR they analysed, and later passes read them back,
 * without the IR classes having to know about every analysis.
 * Whether an attached result is still up to date is tracked separately, by the
 * {@link io.github.eutro.liveopt.ext.MetadataState} of the graph.
 */
package io.github.eutro.liveopt.ext;
