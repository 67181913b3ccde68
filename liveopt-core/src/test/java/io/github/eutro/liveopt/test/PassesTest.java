package io.github.eutro.liveopt.test;

import io.github.eutro.liveopt.ext.CommonExts;
import io.github.eutro.liveopt.ext.MetadataState;
import io.github.eutro.liveopt.ir.BasicBlock;
import io.github.eutro.liveopt.ir.Cfg;
import io.github.eutro.liveopt.ir.CfgBuilder;
import io.github.eutro.liveopt.ir.IdentSet;
import io.github.eutro.liveopt.ir.InvalidCfgException;
import io.github.eutro.liveopt.passes.IRPass;
import io.github.eutro.liveopt.passes.InPlaceIRPass;
import io.github.eutro.liveopt.passes.Passes;
import io.github.eutro.liveopt.passes.meta.VerifyIntegrity;
import io.github.eutro.liveopt.passes.meta.VerifyLiveness;
import io.github.eutro.liveopt.passes.misc.ChainedPass;
import io.github.eutro.liveopt.passes.misc.ForPass;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static io.github.eutro.liveopt.ir.AtomicExp.num;
import static io.github.eutro.liveopt.test.Utils.liveExit;
import static org.junit.jupiter.api.Assertions.*;

public class PassesTest {
    @Test
    void testChainOrder() {
        List<String> ran = new ArrayList<>();
        IRPass<String, Integer> length = s -> {
            ran.add("length");
            return s.length();
        };
        IRPass<Integer, Integer> doubled = i -> {
            ran.add("doubled");
            return i * 2;
        };
        IRPass<Integer, String> shown = i -> {
            ran.add("shown");
            return "#" + i;
        };

        IRPass<String, String> chain = length.then(doubled).then(shown);
        assertFalse(chain.isInPlace());
        assertEquals(Arrays.asList(length, doubled, shown), ((ChainedPass<?, ?>) chain).getPasses());
        assertEquals("#8", chain.run("abcd"));
        assertEquals(Arrays.asList("length", "doubled", "shown"), ran);
    }

    @Test
    void testChainReportsFailingPass() {
        InPlaceIRPass<Cfg> ok = cfg -> {
        };
        InPlaceIRPass<Cfg> bad = cfg -> {
            throw new IllegalStateException("bad pass");
        };
        IRPass<Cfg, Cfg> chain = ok.then(ok).then(bad);
        assertTrue(chain.isInPlace());

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> chain.run(new Cfg()));
        assertEquals("bad pass", e.getMessage());
        assertEquals(1, e.getSuppressed().length);
        assertTrue(e.getSuppressed()[0].getMessage().startsWith("running pass 2 in chain"));
    }

    @Test
    void testForBlocks() {
        CfgBuilder b = new CfgBuilder();
        b.block(0).end();
        b.block(4).end();
        b.block(2).end();
        Cfg cfg = b.build();

        List<Integer> seen = new ArrayList<>();
        ForPass.liftBasicBlocks(block -> seen.add(block.getIndex())).runInPlace(cfg);
        assertEquals(Arrays.asList(0, 4, 2), seen);

        InPlaceIRPass<Cfg> failing = ForPass.liftBasicBlocks(block -> {
            if (block.getIndex() == 4) throw new IllegalArgumentException("no fours");
        });
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> failing.runInPlace(cfg));
        assertEquals("in block 4", e.getSuppressed()[0].getMessage());
    }

    @Test
    void testVerifyIntegrity() {
        VerifyIntegrity.INSTANCE.runInPlace(Utils.nestedLoops());

        CfgBuilder b = new CfgBuilder();
        b.block(0).jump(1);
        b.block(1).branch(1, 0, 5);
        InvalidCfgException e = assertThrows(InvalidCfgException.class,
                () -> VerifyIntegrity.INSTANCE.runInPlace(b.build()));
        assertTrue(e.getMessage().contains("referenced: 5"), e.getMessage());
        assertTrue(e.getMessage().contains("in block: block 1"), e.getMessage());
    }

    @Test
    void testCheckedLiveness() {
        Cfg cfg = Passes.CHECKED_LIVENESS.run(Utils.nestedLoops());
        assertTrue(cfg.getExtOrThrow(CommonExts.METADATA_STATE).isValid(MetadataState.LIVE_DATA));
        assertEquals(IdentSet.of(1, 2), liveExit(cfg, 0));
        assertEquals(new IdentSet(), liveExit(cfg, 5));
    }

    @Test
    void testCheckedLivenessRejectsBadGraph() {
        CfgBuilder b = new CfgBuilder();
        b.block(0).jump(3);
        InvalidCfgException e = assertThrows(InvalidCfgException.class,
                () -> Passes.CHECKED_LIVENESS.run(b.build()));
        assertTrue(e.getSuppressed()[0].getMessage().startsWith("running pass 0 in chain: VerifyIntegrity"));
    }

    @Test
    void testDeadStoresToFixpoint() {
        CfgBuilder b = new CfgBuilder();
        b.block(0).assign(1, num(5)).jump(1);
        b.block(1).copy(2, 1).copy(3, 2).end();
        Cfg cfg = Passes.DEAD_STORES_TO_FIXPOINT.run(b.build());

        assertEquals(0, cfg.insnCount());
        for (BasicBlock block : cfg.getBlocks()) {
            assertTrue(block.getExtOrThrow(CommonExts.LIVE_DATA).liveExit.isEmpty());
        }
        VerifyLiveness.INSTANCE.runInPlace(cfg);
    }

    @Test
    void testDeadStores() {
        CfgBuilder b = new CfgBuilder();
        b.block(0).assign(1, num(5)).jump(1);
        b.block(1).copy(2, 1).copy(3, 2).end();
        Cfg cfg = Passes.DEAD_STORES.run(b.build());

        assertEquals(1, cfg.insnCount());
        assertFalse(cfg.getExtOrThrow(CommonExts.METADATA_STATE).isValid(MetadataState.LIVE_DATA));
    }
}
