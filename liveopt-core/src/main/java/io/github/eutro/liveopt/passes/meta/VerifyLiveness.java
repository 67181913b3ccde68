package io.github.eutro.liveopt.passes.meta;

import io.github.eutro.liveopt.ext.CommonExts;
import io.github.eutro.liveopt.ext.CommonExts.LiveData;
import io.github.eutro.liveopt.ext.MetadataState;
import io.github.eutro.liveopt.ir.BasicBlock;
import io.github.eutro.liveopt.ir.Cfg;
import io.github.eutro.liveopt.ir.IdentSet;
import io.github.eutro.liveopt.ir.OperandPolicy;
import io.github.eutro.liveopt.passes.InPlaceIRPass;

/**
 * Checks that the {@link CommonExts#LIVE_DATA} of a graph is a fixed point of the liveness equations,
 * and that each block's gen and kill sets match its instructions.
 * <p>
 * Throws {@link IllegalStateException} on the first block that doesn't hold.
 */
public class VerifyLiveness implements InPlaceIRPass<Cfg> {
    public static final VerifyLiveness INSTANCE = new VerifyLiveness();

    @Override
    public void runInPlace(Cfg cfg) {
        MetadataState ms = cfg.getExtOrThrow(CommonExts.METADATA_STATE);
        if (!ms.isValid(MetadataState.LIVE_DATA)) {
            throw new IllegalStateException("liveness has not been computed, or is out of date");
        }
        OperandPolicy policy = cfg.getExtOrThrow(CommonExts.OPERAND_POLICY);

        for (BasicBlock block : cfg.getBlocks()) {
            LiveData data = block.getExtOrThrow(CommonExts.LIVE_DATA);
            LiveData fresh = ComputeLocalLiveness.analyse(block, policy);
            if (!fresh.gen.equals(data.gen) || !fresh.kill.equals(data.kill)) {
                throw new IllegalStateException(String.format(
                        "stale gen/kill sets\n  expected: %s\n  found: %s\n  in block: %s",
                        fresh,
                        data,
                        block));
            }

            IdentSet expected = new IdentSet();
            for (BasicBlock succ : cfg.successors(block)) {
                expected.addAll(succ.getExtOrThrow(CommonExts.LIVE_DATA).liveEntry());
            }
            if (!expected.equals(data.liveExit)) {
                throw new IllegalStateException(String.format(
                        "live exit set is not a fixed point\n  expected: %s\n  found: %s\n  in block: %s",
                        expected,
                        data.liveExit,
                        block));
            }
        }
    }

    @Override
    public String toString() {
        return "VerifyLiveness";
    }
}
