package io.github.eutro.liveopt.passes.meta;

import io.github.eutro.liveopt.ext.CommonExts;
import io.github.eutro.liveopt.ext.CommonExts.LiveData;
import io.github.eutro.liveopt.ext.MetadataState;
import io.github.eutro.liveopt.ir.BasicBlock;
import io.github.eutro.liveopt.ir.Cfg;
import io.github.eutro.liveopt.ir.IdentSet;
import io.github.eutro.liveopt.ir.OperandPolicy;
import io.github.eutro.liveopt.passes.InPlaceIRPass;
import io.github.eutro.liveopt.passes.misc.ForPass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Computes the {@link CommonExts#LIVE_DATA} for each block, solving
 * <pre>
 * liveEntry(n) = gen(n) ∪ (liveExit(n) \ kill(n))
 * liveExit(n)  = ⋃ liveEntry(s), for each successor s of n
 * </pre>
 * to the least fixed point.
 * <p>
 * The blocks are partitioned between a worklist and a finished set. When a block is taken
 * off the worklist its live entry set is pushed into the live exit set of each predecessor,
 * and any predecessor that grew goes (back) on the worklist. Live exit sets only ever grow,
 * and there are finitely many identifiers, so this terminates.
 */
public class ComputeLiveVars implements InPlaceIRPass<Cfg> {
    private static final Logger LOGGER = LogManager.getLogger(ComputeLiveVars.class);

    /**
     * An instance of this pass, using the {@link OperandPolicy#DEFAULT default policy}.
     */
    public static final ComputeLiveVars INSTANCE = new ComputeLiveVars(OperandPolicy.DEFAULT);

    /**
     * Observes the progress of the solver.
     */
    public interface Listener {
        /**
         * A listener that does nothing.
         */
        Listener NONE = new Listener() {
        };

        /**
         * Called when a block is taken off the worklist.
         *
         * @param block The block.
         */
        default void blockVisited(BasicBlock block) {
        }

        /**
         * Called when the live exit set of a block grows.
         *
         * @param block  The block.
         * @param before The live exit set before.
         * @param after  The live exit set after.
         */
        default void exitWidened(BasicBlock block, IdentSet before, IdentSet after) {
        }
    }

    private final OperandPolicy policy;
    private final Listener listener;
    private final ForPass.BasicBlocks local;

    public ComputeLiveVars(OperandPolicy policy) {
        this(policy, Listener.NONE);
    }

    public ComputeLiveVars(OperandPolicy policy, Listener listener) {
        this.policy = policy;
        this.listener = listener;
        local = ForPass.liftBasicBlocks(new ComputeLocalLiveness(policy));
    }

    public OperandPolicy getPolicy() {
        return policy;
    }

    @Override
    public void runInPlace(Cfg cfg) {
        MetadataState ms = cfg.getExtOrThrow(CommonExts.METADATA_STATE);
        ms.ensureValid(cfg, MetadataState.PREDS);

        local.runInPlace(cfg);

        List<BasicBlock> blocks = cfg.getBlocks();
        Set<BasicBlock> workList = new LinkedHashSet<>();
        for (ListIterator<BasicBlock> li = blocks.listIterator(blocks.size()); li.hasPrevious(); ) {
            workList.add(li.previous());
        }
        Set<BasicBlock> finished = new HashSet<>();

        int visits = 0;
        int widenings = 0;
        while (!workList.isEmpty()) {
            Iterator<BasicBlock> iterator = workList.iterator();
            BasicBlock next = iterator.next();
            iterator.remove();
            visits++;
            listener.blockVisited(next);

            IdentSet liveEntry = next.getExtOrThrow(CommonExts.LIVE_DATA).liveEntry();
            for (BasicBlock pred : next.getExtOrThrow(CommonExts.PREDS)) {
                LiveData predData = pred.getExtOrThrow(CommonExts.LIVE_DATA);
                if (liveEntry.isSubsetOf(predData.liveExit)) continue;

                IdentSet before = predData.liveExit.copy();
                predData.liveExit.addAll(liveEntry);
                widenings++;
                listener.exitWidened(pred, before, predData.liveExit.copy());

                finished.remove(pred);
                workList.add(pred);
            }
            // a self-loop may have just put it back
            if (!workList.contains(next)) {
                finished.add(next);
            }
        }

        if (finished.size() != blocks.size()) {
            throw new IllegalStateException(String.format(
                    "worklist finished with %d of %d blocks",
                    finished.size(),
                    blocks.size()));
        }

        cfg.attachExt(CommonExts.OPERAND_POLICY, policy);
        ms.validate(MetadataState.LIVE_DATA);
        LOGGER.debug("Liveness of {} blocks converged after {} visits, {} widenings", blocks.size(), visits, widenings);
    }

    @Override
    public String toString() {
        return "ComputeLiveVars(" + policy + ")";
    }
}
