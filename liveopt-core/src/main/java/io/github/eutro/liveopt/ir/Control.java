package io.github.eutro.liveopt.ir;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The control transfer at the end of a {@link BasicBlock}. Targets are block indices.
 */
public abstract class Control {
    private Control() {
    }

    public static End end() {
        return End.INSTANCE;
    }

    public static Next next(int target) {
        return new Next(target);
    }

    public static Branch branch(int cond, int ifTrue, int ifFalse) {
        return new Branch(cond, ifTrue, ifFalse);
    }

    /**
     * Get the indices of the blocks control may be transferred to.
     * <p>
     * A block may appear more than once.
     *
     * @return The target indices.
     */
    public abstract List<Integer> targets();

    /**
     * Add the identifiers this control transfer reads to {@code set}.
     *
     * @param set    The set to add to.
     * @param policy Whether branch conditions count as reads.
     */
    public void addReadsTo(IdentSet set, OperandPolicy policy) {
    }

    /**
     * No successor.
     */
    public static final class End extends Control {
        static final End INSTANCE = new End();

        private End() {
        }

        @Override
        public List<Integer> targets() {
            return Collections.emptyList();
        }

        @Override
        public String toString() {
            return "end";
        }
    }

    /**
     * An unconditional jump.
     */
    public static final class Next extends Control {
        public final int target;

        private Next(int target) {
            this.target = target;
        }

        @Override
        public List<Integer> targets() {
            return Collections.singletonList(target);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Next && ((Next) o).target == target;
        }

        @Override
        public int hashCode() {
            return Objects.hash(Next.class, target);
        }

        @Override
        public String toString() {
            return "next -> " + target;
        }
    }

    /**
     * A two-way branch on the value of {@link #cond}.
     */
    public static final class Branch extends Control {
        public final int cond;
        public final int ifTrue;
        public final int ifFalse;

        private Branch(int cond, int ifTrue, int ifFalse) {
            this.cond = Insn.checkIdent(cond);
            this.ifTrue = ifTrue;
            this.ifFalse = ifFalse;
        }

        @Override
        public List<Integer> targets() {
            return Arrays.asList(ifTrue, ifFalse);
        }

        @Override
        public void addReadsTo(IdentSet set, OperandPolicy policy) {
            if (policy == OperandPolicy.CONSERVATIVE) {
                set.add(cond);
            }
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Branch)) return false;
            Branch that = (Branch) o;
            return cond == that.cond && ifTrue == that.ifTrue && ifFalse == that.ifFalse;
        }

        @Override
        public int hashCode() {
            return Objects.hash(Branch.class, cond, ifTrue, ifFalse);
        }

        @Override
        public String toString() {
            return "branch $" + cond + " -> " + ifTrue + " " + ifFalse;
        }
    }
}
