package io.github.eutro.liveopt.passes.meta;

import io.github.eutro.liveopt.ext.CommonExts;
import io.github.eutro.liveopt.ext.MetadataState;
import io.github.eutro.liveopt.ir.BasicBlock;
import io.github.eutro.liveopt.ir.Cfg;
import io.github.eutro.liveopt.ir.InvalidCfgException;
import io.github.eutro.liveopt.passes.InPlaceIRPass;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes {@link CommonExts#PREDS} for each block.
 * <p>
 * A predecessor is listed once even if it branches to the block on both edges.
 * Throws {@link InvalidCfgException} if a control transfer targets a block that is not in the graph.
 */
public class ComputePreds implements InPlaceIRPass<Cfg> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputePreds INSTANCE = new ComputePreds();

    @Override
    public void runInPlace(Cfg cfg) {
        MetadataState ms = cfg.getExtOrThrow(CommonExts.METADATA_STATE);

        for (BasicBlock block : cfg.getBlocks()) {
            block.attachExt(CommonExts.PREDS, new ArrayList<>());
        }
        for (BasicBlock block : cfg.getBlocks()) {
            for (BasicBlock target : cfg.successors(block)) {
                List<BasicBlock> preds = target.getExtOrThrow(CommonExts.PREDS);
                if (preds.isEmpty() || preds.get(preds.size() - 1) != block) {
                    preds.add(block);
                }
            }
        }

        ms.validate(MetadataState.PREDS);
    }

    @Override
    public String toString() {
        return "ComputePreds";
    }
}
