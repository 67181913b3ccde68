package io.github.eutro.liveopt.passes.misc;

import io.github.eutro.liveopt.passes.IRPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A pass which runs a sequence of others, giving each the result of the one before.
 * <p>
 * Chaining a chain appends to it, so {@code a.then(b).then(c)} holds {@code [a, b, c]}.
 * If a pass in the chain throws, the exception carries a suppressed one naming its position.
 *
 * @param <A> The input type.
 * @param <C> The output type.
 */
public class ChainedPass<A, C> implements IRPass<A, C> {
    private final List<IRPass<?, ?>> passes;
    private final boolean isInPlace;

    /**
     * Construct a chained pass.
     *
     * @param firstPass The first pass to run.
     * @param nextPass  The next pass to run.
     * @param <B>       The intermediate type.
     */
    public <B> ChainedPass(IRPass<A, B> firstPass, IRPass<B, C> nextPass) {
        List<IRPass<?, ?>> passes = new ArrayList<>();
        addFlat(passes, firstPass);
        addFlat(passes, nextPass);
        this.passes = Collections.unmodifiableList(passes);
        isInPlace = firstPass.isInPlace() && nextPass.isInPlace();
    }

    private static void addFlat(List<IRPass<?, ?>> passes, IRPass<?, ?> pass) {
        if (pass instanceof ChainedPass) {
            passes.addAll(((ChainedPass<?, ?>) pass).passes);
        } else {
            passes.add(pass);
        }
    }

    /**
     * Get the passes this runs, in order.
     *
     * @return The passes.
     */
    public List<IRPass<?, ?>> getPasses() {
        return passes;
    }

    @Override
    public boolean isInPlace() {
        return isInPlace;
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        Object acc = a;
        for (int i = 0; i < passes.size(); i++) {
            IRPass<Object, Object> pass = (IRPass<Object, Object>) passes.get(i);
            try {
                acc = pass.run(acc);
            } catch (RuntimeException e) {
                e.addSuppressed(new RuntimeException("running pass " + i + " in chain: " + pass));
                throw e;
            }
        }
        return (C) acc;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (IRPass<?, ?> pass : passes) {
            if (sb.length() != 0) sb.append(" -> ");
            sb.append(pass);
        }
        return sb.toString();
    }
}
