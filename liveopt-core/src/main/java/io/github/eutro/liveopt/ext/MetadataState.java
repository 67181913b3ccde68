package io.github.eutro.liveopt.ext;

import io.github.eutro.liveopt.ir.Cfg;
import io.github.eutro.liveopt.passes.IRPass;
import io.github.eutro.liveopt.passes.meta.ComputeLiveVars;
import io.github.eutro.liveopt.passes.meta.ComputePreds;

import java.util.BitSet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps track of which metadata of a {@link Cfg} is up to date.
 */
public class MetadataState {
    /**
     * A kind of metadata whose validity can be tracked.
     */
    public static class MetaKind {
        private static final AtomicInteger COUNTER = new AtomicInteger();
        final int id = COUNTER.getAndIncrement();
        final String name;

        MetaKind(String name) {
            this.name = name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A kind of metadata which also knows how to compute itself.
     *
     * @param <T> The IR the computing passes run on.
     */
    public static class ComputableMetaKind<T> extends MetaKind {
        private final IRPass<T, T>[] passes;

        @SafeVarargs
        ComputableMetaKind(String name, IRPass<T, T>... passes) {
            super(name);
            this.passes = passes;
        }

        void computeFor(T t) {
            for (IRPass<T, T> pass : passes) {
                if (!pass.isInPlace()) throw new IllegalArgumentException(pass + " is not in-place");
                pass.run(t);
            }
        }
    }

    public static final ComputableMetaKind<Cfg>
            PREDS = new ComputableMetaKind<>("PREDS", ComputePreds.INSTANCE),
            LIVE_DATA = new ComputableMetaKind<>("LIVE_DATA", ComputeLiveVars.INSTANCE);

    private final BitSet validSet = new BitSet();

    public boolean isValid(MetaKind kind) {
        return validSet.get(kind.id);
    }

    /**
     * Compute each of the given metadata that is not currently valid.
     *
     * @param t     The IR to compute the metadata on.
     * @param first The first metadata kind.
     * @param kinds The other metadata kinds.
     * @param <T>   The type of {@code t}.
     */
    @SafeVarargs
    public final <T> void ensureValid(T t, ComputableMetaKind<T> first, ComputableMetaKind<T>... kinds) {
        ensureValid0(t, first);
        for (ComputableMetaKind<T> kind : kinds) {
            ensureValid0(t, kind);
        }
    }

    private <T> void ensureValid0(T t, ComputableMetaKind<T> kind) {
        if (!isValid(kind)) {
            kind.computeFor(t);
            validate(kind);
        }
    }

    public void validate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id, true);
        }
    }

    public void invalidate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id, false);
        }
    }

    /**
     * Invalidate everything that depends on the shape of the graph:
     * the set of blocks or their control transfers.
     */
    public void graphChanged() {
        invalidate(PREDS);
        insnsChanged();
    }

    /**
     * Invalidate everything that depends on the instructions of a block.
     */
    public void insnsChanged() {
        invalidate(LIVE_DATA);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("valid: [");
        String sep = "";
        for (MetaKind kind : new MetaKind[]{PREDS, LIVE_DATA}) {
            if (isValid(kind)) {
                sb.append(sep).append(kind);
                sep = ", ";
            }
        }
        return sb.append(']').toString();
    }
}
