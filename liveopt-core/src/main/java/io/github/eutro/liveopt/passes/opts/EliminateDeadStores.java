package io.github.eutro.liveopt.passes.opts;

import io.github.eutro.liveopt.ext.CommonExts;
import io.github.eutro.liveopt.ext.CommonExts.LiveData;
import io.github.eutro.liveopt.ext.MetadataState;
import io.github.eutro.liveopt.ir.*;
import io.github.eutro.liveopt.passes.InPlaceIRPass;
import io.github.eutro.liveopt.passes.meta.ComputeLiveVars;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.ListIterator;

/**
 * A pass which removes writes to identifiers that are not live immediately after the write.
 * <p>
 * {@link Insn.Store Stores} and {@link Insn.Output outputs} are never removed. Blocks and their
 * control transfers are left alone.
 * <p>
 * Liveness is (re)computed first if it is not valid for the graph, or was computed with a
 * different {@link OperandPolicy}. Each block is then handled on its own, starting from its live exit set.
 * <p>
 * Removing a write can make writes in other blocks dead, so a single run may leave dead stores behind;
 * {@link #TO_FIXPOINT} repeats until nothing more is removed.
 */
public class EliminateDeadStores implements InPlaceIRPass<Cfg> {
    private static final Logger LOGGER = LogManager.getLogger(EliminateDeadStores.class);

    /**
     * An instance of this pass, using the {@link OperandPolicy#DEFAULT default policy}, running once.
     */
    public static final EliminateDeadStores INSTANCE = new EliminateDeadStores(OperandPolicy.DEFAULT, false);

    /**
     * An instance of this pass, using the {@link OperandPolicy#DEFAULT default policy},
     * running until no more writes can be removed.
     */
    public static final EliminateDeadStores TO_FIXPOINT = new EliminateDeadStores(OperandPolicy.DEFAULT, true);

    private final OperandPolicy policy;
    private final boolean toFixpoint;
    private final ComputeLiveVars liveness;

    public EliminateDeadStores(OperandPolicy policy, boolean toFixpoint) {
        this.policy = policy;
        this.toFixpoint = toFixpoint;
        liveness = policy == ComputeLiveVars.INSTANCE.getPolicy()
                ? ComputeLiveVars.INSTANCE
                : new ComputeLiveVars(policy);
    }

    @Override
    public void runInPlace(Cfg cfg) {
        if (!toFixpoint) {
            eliminate(cfg);
            return;
        }
        int rounds = 1;
        int total = 0;
        int removed;
        while ((removed = eliminate(cfg)) != 0) {
            total += removed;
            rounds++;
        }
        LOGGER.debug("Removed {} dead stores in {} rounds", total, rounds);
    }

    /**
     * Run a single round of elimination over the graph.
     *
     * @param cfg The graph.
     * @return The number of instructions removed.
     */
    public int eliminate(Cfg cfg) {
        MetadataState ms = cfg.getExtOrThrow(CommonExts.METADATA_STATE);
        if (!ms.isValid(MetadataState.LIVE_DATA) || cfg.getNullable(CommonExts.OPERAND_POLICY) != policy) {
            liveness.runInPlace(cfg);
        }

        int removed = 0;
        for (BasicBlock block : cfg.getBlocks()) {
            LiveData data = block.getNullable(CommonExts.LIVE_DATA);
            if (data == null) {
                throw new InvalidCfgException(String.format(
                        "block has no liveness data\n  in block: %s",
                        block.toTargetString()));
            }
            removed += removeUnusedWrites(block, data.liveExit, policy);
        }

        if (removed != 0) {
            ms.insnsChanged();
        }
        LOGGER.debug("Removed {} dead stores from {} blocks", removed, cfg.getBlocks().size());
        return removed;
    }

    /**
     * Remove the dead writes of one block.
     *
     * @param block    The block.
     * @param liveExit The identifiers live at the end of the block. Not modified.
     * @param policy   Whether address operands and branch conditions are reads.
     * @return The number of instructions removed.
     */
    public static int removeUnusedWrites(BasicBlock block, IdentSet liveExit, OperandPolicy policy) {
        IdentSet live = liveExit.copy();
        block.getNext().addReadsTo(live, policy);

        int removed = 0;
        List<Insn> insns = block.getInsns();
        for (ListIterator<Insn> li = insns.listIterator(insns.size()); li.hasPrevious(); ) {
            Insn insn = li.previous();
            if (insn.hasDest()) {
                int dest = insn.dest();
                if (!live.contains(dest)) {
                    li.remove();
                    removed++;
                    continue;
                }
                live.remove(dest);
            }
            insn.addReadsTo(live, policy);
        }
        return removed;
    }

    @Override
    public String toString() {
        return "EliminateDeadStores(" + policy + (toFixpoint ? ", to fixpoint" : "") + ")";
    }
}
