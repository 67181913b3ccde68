package io.github.eutro.liveopt.passes;

import io.github.eutro.liveopt.ext.MetadataState;

/**
 * A pass which annotates or rewrites a {@link io.github.eutro.liveopt.ir.Cfg Cfg} or
 * {@link io.github.eutro.liveopt.ir.BasicBlock BasicBlock} in place, and returns it unchanged in identity.
 * <p>
 * Analyses attach their results as exts and {@link MetadataState#validate validate} them.
 * Rewrites go through the block and graph mutators, which invalidate what they affect.
 *
 * @param <T> The IR node this pass operates on.
 */
public interface InPlaceIRPass<T> extends IRPass<T, T> {
    /**
     * Run the pass, modifying {@code t}.
     *
     * @param t The IR node.
     */
    void runInPlace(T t);

    @Override
    default T run(T t) {
        runInPlace(t);
        return t;
    }

    @Override
    default boolean isInPlace() {
        return true;
    }
}
