package io.github.eutro.liveopt.ext;

import io.github.eutro.liveopt.ir.BasicBlock;
import io.github.eutro.liveopt.ir.Cfg;
import io.github.eutro.liveopt.ir.IdentSet;
import io.github.eutro.liveopt.ir.OperandPolicy;
import io.github.eutro.liveopt.passes.meta.ComputeLiveVars;
import io.github.eutro.liveopt.passes.meta.ComputeLocalLiveness;
import io.github.eutro.liveopt.passes.meta.ComputePreds;

import java.util.List;

/**
 * The {@link Ext}s attached to the IR by the passes in this library.
 */
public class CommonExts {
    /**
     * Attached to a {@link Cfg}. Tracks which metadata is currently valid.
     *
     * @see MetadataState
     */
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");

    /**
     * Attached to a {@link BasicBlock}. The blocks whose control transfer targets the block,
     * each listed once, in graph order.
     * <p>
     * Computed by {@link ComputePreds}.
     */
    public static final Ext<List<BasicBlock>> PREDS = Ext.create(List.class, "PREDS");

    /**
     * Attached to a {@link BasicBlock}, computed by {@link ComputeLocalLiveness} and
     * completed by {@link ComputeLiveVars}. The live variable information of the block.
     */
    public static final Ext<LiveData> LIVE_DATA = Ext.create(LiveData.class, "LIVE_DATA");

    /**
     * Attached to a {@link Cfg}. The operand policy the current {@link #LIVE_DATA} was computed with.
     */
    public static final Ext<OperandPolicy> OPERAND_POLICY = Ext.create(OperandPolicy.class, "OPERAND_POLICY");

    /**
     * Live variable information for a basic block.
     */
    public static class LiveData {
        /**
         * The identifiers read in the block before any write to them in the block.
         */
        public final IdentSet gen;
        /**
         * The identifiers written anywhere in the block.
         */
        public final IdentSet kill;
        /**
         * The identifiers that are alive at the end of the block.
         * Only ever grows while liveness is being computed.
         */
        public final IdentSet liveExit = new IdentSet();

        public LiveData(IdentSet gen, IdentSet kill) {
            this.gen = gen;
            this.kill = kill;
        }

        /**
         * Compute the identifiers that are alive at the start of the block,
         * {@code gen ∪ (liveExit \ kill)}.
         *
         * @return A new set of the live identifiers.
         */
        public IdentSet liveEntry() {
            IdentSet entry = liveExit.minus(kill);
            entry.addAll(gen);
            return entry;
        }

        @Override
        public String toString() {
            return "gen: " + gen + ", kill: " + kill + ", live exit: " + liveExit;
        }
    }
}
