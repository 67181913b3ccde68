package io.github.eutro.liveopt.passes.meta;

import io.github.eutro.liveopt.ir.BasicBlock;
import io.github.eutro.liveopt.ir.Cfg;
import io.github.eutro.liveopt.ir.InvalidCfgException;
import io.github.eutro.liveopt.passes.InPlaceIRPass;

/**
 * Checks that a graph is well-formed, throwing {@link InvalidCfgException} if it is not.
 * <p>
 * Every block must be owned by the graph and reachable by its index,
 * and every control transfer target must name a block of the graph.
 */
public class VerifyIntegrity implements InPlaceIRPass<Cfg> {
    public static final VerifyIntegrity INSTANCE = new VerifyIntegrity();

    @Override
    public void runInPlace(Cfg cfg) {
        for (BasicBlock block : cfg.getBlocks()) {
            if (block.getOwner() != cfg || cfg.findBlock(block.getIndex()) != block) {
                throw new InvalidCfgException(String.format(
                        "block not owned by graph\n  block: %s",
                        block));
            }
            cfg.successors(block);
        }
    }

    @Override
    public String toString() {
        return "VerifyIntegrity";
    }
}
