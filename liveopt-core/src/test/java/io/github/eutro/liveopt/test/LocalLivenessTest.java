package io.github.eutro.liveopt.test;

import io.github.eutro.liveopt.LiveOpt;
import io.github.eutro.liveopt.ext.CommonExts;
import io.github.eutro.liveopt.ext.CommonExts.LiveData;
import io.github.eutro.liveopt.ir.BasicBlock;
import io.github.eutro.liveopt.ir.CfgBuilder;
import io.github.eutro.liveopt.ir.IdentSet;
import io.github.eutro.liveopt.ir.Insn;
import io.github.eutro.liveopt.ir.OperandPolicy;
import io.github.eutro.liveopt.passes.meta.ComputeLocalLiveness;
import org.junit.jupiter.api.Test;

import static io.github.eutro.liveopt.ir.AtomicExp.*;
import static io.github.eutro.liveopt.ir.BinOp.*;
import static org.junit.jupiter.api.Assertions.*;

public class LocalLivenessTest {
    static LiveData analyse(CfgBuilder b) {
        return LiveOpt.analyzeBlockLocal(b.getBlock(), OperandPolicy.FAITHFUL);
    }

    static void assertGenKill(LiveData data, IdentSet gen, IdentSet kill) {
        assertEquals(gen, data.gen, "gen");
        assertEquals(kill, data.kill, "kill");
        assertTrue(data.liveExit.isEmpty(), "live exit");
    }

    @Test
    void testWriteBeforeRead() {
        CfgBuilder b = new CfgBuilder().block(0)
                .assign(1, num(5))
                .assign(2, num(7))
                .output(1);
        // 1 is written before it is read, so it is not exposed upwards
        assertGenKill(analyse(b), IdentSet.of(), IdentSet.of(1, 2));
    }

    @Test
    void testReadBeforeWrite() {
        CfgBuilder b = new CfgBuilder().block(0)
                .output(1)
                .assign(1, num(2));
        assertGenKill(analyse(b), IdentSet.of(1), IdentSet.of(1));
    }

    @Test
    void testSelfUpdate() {
        CfgBuilder b = new CfgBuilder().block(0)
                .assign(1, ident(1), ADD, num(1));
        assertGenKill(analyse(b), IdentSet.of(1), IdentSet.of(1));
    }

    @Test
    void testShadowedByLaterWrite() {
        CfgBuilder b = new CfgBuilder().block(0)
                .assign(1, ident(2))
                .assign(3, ident(1), MUL, ident(4))
                .assign(4, bool(true));
        assertGenKill(analyse(b), IdentSet.of(2, 4), IdentSet.of(1, 3, 4));
    }

    @Test
    void testLiteralsAreNotReads() {
        CfgBuilder b = new CfgBuilder().block(0)
                .assign(1, num(3), LT, bool(false))
                .output(1);
        assertGenKill(analyse(b), IdentSet.of(), IdentSet.of(1));
    }

    @Test
    void testInputIsWriteOnly() {
        CfgBuilder b = new CfgBuilder().block(0)
                .input(3)
                .output(3)
                .output(5);
        assertGenKill(analyse(b), IdentSet.of(5), IdentSet.of(3));
    }

    @Test
    void testMemoryOperands() {
        CfgBuilder b = new CfgBuilder().block(0)
                .load(1, ident(5))
                .store(2, ident(6))
                .output(1);
        BasicBlock block = b.getBlock();

        LiveData faithful = LiveOpt.analyzeBlockLocal(block, OperandPolicy.FAITHFUL);
        assertGenKill(faithful, IdentSet.of(2), IdentSet.of(1));

        LiveData conservative = LiveOpt.analyzeBlockLocal(block, OperandPolicy.CONSERVATIVE);
        assertGenKill(conservative, IdentSet.of(2, 5, 6), IdentSet.of(1));
    }

    @Test
    void testBranchCondition() {
        CfgBuilder b = new CfgBuilder();
        b.block(1).end();
        b.block(0).branch(7, 1, 1);
        BasicBlock block = b.getBlock();

        assertGenKill(LiveOpt.analyzeBlockLocal(block, OperandPolicy.FAITHFUL), IdentSet.of(), IdentSet.of());
        assertGenKill(LiveOpt.analyzeBlockLocal(block, OperandPolicy.CONSERVATIVE), IdentSet.of(7), IdentSet.of());

        block.addInsn(Insn.input(7));
        assertGenKill(LiveOpt.analyzeBlockLocal(block, OperandPolicy.CONSERVATIVE), IdentSet.of(), IdentSet.of(7));
    }

    @Test
    void testPassAttachesLiveData() {
        CfgBuilder b = new CfgBuilder().block(0)
                .assign(2, ident(1), SUB, ident(2))
                .output(2);
        BasicBlock block = b.getBlock();
        assertFalse(block.getExt(CommonExts.LIVE_DATA).isPresent());

        new ComputeLocalLiveness(OperandPolicy.FAITHFUL).runInPlace(block);
        assertGenKill(block.getExtOrThrow(CommonExts.LIVE_DATA), IdentSet.of(1, 2), IdentSet.of(2));
    }

    @Test
    void testEmptyBlock() {
        CfgBuilder b = new CfgBuilder().block(0).end();
        assertGenKill(analyse(b), IdentSet.of(), IdentSet.of());
    }
}
