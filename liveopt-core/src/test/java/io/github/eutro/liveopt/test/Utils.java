package io.github.eutro.liveopt.test;

import io.github.eutro.liveopt.ext.CommonExts;
import io.github.eutro.liveopt.ir.*;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static io.github.eutro.liveopt.ir.AtomicExp.*;
import static io.github.eutro.liveopt.ir.BinOp.*;

public class Utils {
    @NotNull
    public static IdentSet liveExit(Cfg cfg, int index) {
        return cfg.getBlock(index).getExtOrThrow(CommonExts.LIVE_DATA).liveExit;
    }

    @NotNull
    public static List<Insn> insns(Cfg cfg, int index) {
        return new ArrayList<>(cfg.getBlock(index).getInsns());
    }

    /**
     * <pre>
     * 0: $1 := 0; $2 := 0                   next 1
     * 1: $4 := $1 < 10                      branch $4 -> 2 5
     * 2: $3 := 0                            next 3
     * 3: $2 := $2 + $3; $3 := $3 + 1; $5 := $3 < 5
     *                                       branch $5 -> 3 4
     * 4: $1 := $1 + 1                       next 1
     * 5: output $2                          end
     * </pre>
     */
    @NotNull
    public static Cfg nestedLoops() {
        CfgBuilder b = new CfgBuilder();
        b.block(0).assign(1, num(0)).assign(2, num(0)).jump(1);
        b.block(1).assign(4, ident(1), LT, num(10)).branch(4, 2, 5);
        b.block(2).assign(3, num(0)).jump(3);
        b.block(3)
                .assign(2, ident(2), ADD, ident(3))
                .assign(3, ident(3), ADD, num(1))
                .assign(5, ident(3), LT, num(5))
                .branch(5, 3, 4);
        b.block(4).assign(1, ident(1), ADD, num(1)).jump(1);
        b.block(5).output(2).end();
        return b.build();
    }

    /**
     * Build a random, well-formed graph.
     *
     * @param random     The source of randomness.
     * @param identCount The number of distinct identifiers to use.
     * @param reversed   Whether to create the blocks in descending index order.
     * @return The graph.
     */
    @NotNull
    public static Cfg randomCfg(Random random, int identCount, boolean reversed) {
        int blockCount = 1 + random.nextInt(8);
        List<List<Insn>> bodies = new ArrayList<>();
        List<Control> controls = new ArrayList<>();
        for (int i = 0; i < blockCount; i++) {
            List<Insn> body = new ArrayList<>();
            int insnCount = random.nextInt(6);
            for (int j = 0; j < insnCount; j++) {
                body.add(randomInsn(random, identCount));
            }
            bodies.add(body);
            switch (random.nextInt(3)) {
                case 0:
                    controls.add(Control.end());
                    break;
                case 1:
                    controls.add(Control.next(random.nextInt(blockCount)));
                    break;
                default:
                    controls.add(Control.branch(
                            random.nextInt(identCount),
                            random.nextInt(blockCount),
                            random.nextInt(blockCount)));
                    break;
            }
        }

        Cfg cfg = new Cfg();
        for (int k = 0; k < blockCount; k++) {
            int i = reversed ? blockCount - 1 - k : k;
            BasicBlock block = cfg.newBlock(i);
            block.getInsns().addAll(bodies.get(i));
            block.setNext(controls.get(i));
        }
        return cfg;
    }

    private static AtomicExp randomAtom(Random random, int identCount) {
        switch (random.nextInt(4)) {
            case 0:
                return num(random.nextInt(100));
            case 1:
                return bool(random.nextBoolean());
            default:
                return ident(random.nextInt(identCount));
        }
    }

    private static Insn randomInsn(Random random, int identCount) {
        int dest = random.nextInt(identCount);
        switch (random.nextInt(6)) {
            case 0:
                BinOp[] ops = BinOp.values();
                return Insn.assignOp(dest,
                        randomAtom(random, identCount),
                        ops[random.nextInt(ops.length)],
                        randomAtom(random, identCount));
            case 1:
                return Insn.assignAtom(dest, randomAtom(random, identCount));
            case 2:
                return Insn.load(dest, randomAtom(random, identCount));
            case 3:
                return Insn.store(dest, randomAtom(random, identCount));
            case 4:
                return Insn.input(dest);
            default:
                return Insn.output(dest);
        }
    }
}
