package io.github.eutro.liveopt.passes;

import io.github.eutro.liveopt.ir.Cfg;
import io.github.eutro.liveopt.passes.meta.ComputeLiveVars;
import io.github.eutro.liveopt.passes.meta.VerifyIntegrity;
import io.github.eutro.liveopt.passes.meta.VerifyLiveness;
import io.github.eutro.liveopt.passes.opts.EliminateDeadStores;

/**
 * Some pre-composed passes.
 */
public class Passes {
    /**
     * Check the graph, then compute and check its liveness.
     */
    public static final IRPass<Cfg, Cfg> CHECKED_LIVENESS =
            VerifyIntegrity.INSTANCE
                    .then(ComputeLiveVars.INSTANCE)
                    .then(VerifyLiveness.INSTANCE);

    /**
     * Compute liveness, then remove dead stores once.
     */
    public static final IRPass<Cfg, Cfg> DEAD_STORES =
            ComputeLiveVars.INSTANCE
                    .then(EliminateDeadStores.INSTANCE);

    /**
     * Check the graph, then remove dead stores until there are none left,
     * leaving the graph with valid liveness for its final instructions.
     */
    public static final IRPass<Cfg, Cfg> DEAD_STORES_TO_FIXPOINT =
            VerifyIntegrity.INSTANCE
                    .then(EliminateDeadStores.TO_FIXPOINT);
}
