package io.github.eutro.liveopt.passes.misc;

import io.github.eutro.liveopt.ir.BasicBlock;
import io.github.eutro.liveopt.ir.Cfg;
import io.github.eutro.liveopt.passes.InPlaceIRPass;

/**
 * Lifts passes which operate on smaller IR parts into ones that operate on bigger parts.
 */
public class ForPass {
    /**
     * Lift an in-place basic block pass to operate on a full graph.
     *
     * @param pass The basic block pass.
     * @return The graph pass.
     */
    public static BasicBlocks liftBasicBlocks(InPlaceIRPass<BasicBlock> pass) {
        return new BasicBlocks(pass);
    }

    /**
     * A basic block pass lifted to operate on a full graph, running on each block in order.
     */
    public static class BasicBlocks implements InPlaceIRPass<Cfg> {
        private final InPlaceIRPass<BasicBlock> pass;

        private BasicBlocks(InPlaceIRPass<BasicBlock> pass) {
            this.pass = pass;
        }

        @Override
        public void runInPlace(Cfg cfg) {
            for (BasicBlock block : cfg.getBlocks()) {
                try {
                    pass.runInPlace(block);
                } catch (RuntimeException e) {
                    e.addSuppressed(new RuntimeException("in " + block.toTargetString()));
                    throw e;
                }
            }
        }

        @Override
        public String toString() {
            return "for each block: " + pass;
        }
    }
}
