package io.github.eutro.liveopt;

import io.github.eutro.liveopt.ext.CommonExts.LiveData;
import io.github.eutro.liveopt.ir.BasicBlock;
import io.github.eutro.liveopt.ir.Cfg;
import io.github.eutro.liveopt.ir.InvalidCfgException;
import io.github.eutro.liveopt.ir.OperandPolicy;
import io.github.eutro.liveopt.passes.meta.ComputeLiveVars;
import io.github.eutro.liveopt.passes.meta.ComputeLocalLiveness;
import io.github.eutro.liveopt.passes.opts.EliminateDeadStores;

/**
 * Entry points for live variable analysis and dead store elimination.
 * <p>
 * These are thin wrappers over the passes in {@link io.github.eutro.liveopt.passes}, which
 * can also be used and composed directly.
 */
public final class LiveOpt {
    private LiveOpt() {
    }

    /**
     * Compute the gen and kill sets of one block, without attaching them.
     *
     * @param block The block.
     * @return The live data, with an empty live exit set.
     */
    public static LiveData analyzeBlockLocal(BasicBlock block) {
        return analyzeBlockLocal(block, OperandPolicy.DEFAULT);
    }

    public static LiveData analyzeBlockLocal(BasicBlock block, OperandPolicy policy) {
        return ComputeLocalLiveness.analyse(block, policy);
    }

    /**
     * Compute the liveness of every block of a graph, attaching it as
     * {@link io.github.eutro.liveopt.ext.CommonExts#LIVE_DATA}.
     *
     * @param cfg The graph.
     * @return The same graph, annotated.
     * @throws InvalidCfgException If a control transfer targets a block that is not in the graph.
     */
    public static Cfg computeLiveness(Cfg cfg) {
        return ComputeLiveVars.INSTANCE.run(cfg);
    }

    public static Cfg computeLiveness(Cfg cfg, OperandPolicy policy) {
        return new ComputeLiveVars(policy).run(cfg);
    }

    /**
     * Remove the writes of a graph whose results are never read, computing liveness first if needed.
     *
     * @param cfg The graph.
     * @return The same graph, with dead writes removed.
     * @throws InvalidCfgException If a control transfer targets a block that is not in the graph.
     */
    public static Cfg eliminateDeadStores(Cfg cfg) {
        return EliminateDeadStores.INSTANCE.run(cfg);
    }

    public static Cfg eliminateDeadStores(Cfg cfg, OperandPolicy policy) {
        return new EliminateDeadStores(policy, false).run(cfg);
    }
}
