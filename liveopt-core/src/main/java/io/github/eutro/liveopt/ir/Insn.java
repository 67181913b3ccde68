package io.github.eutro.liveopt.ir;

import java.util.Objects;

/**
 * An instruction in a {@link BasicBlock}.
 * <p>
 * Instructions are immutable, and compare structurally.
 * An instruction either writes exactly one identifier, its {@link #dest() destination},
 * or writes none and has an externally observable effect instead.
 */
public abstract class Insn {
    /**
     * The kinds of instruction.
     */
    public enum Kind {
        ASSIGN_OP,
        ASSIGN_ATOM,
        LOAD,
        STORE,
        INPUT,
        OUTPUT,
    }

    private final Kind kind;

    private Insn(Kind kind) {
        this.kind = kind;
    }

    /**
     * {@code dest := lhs op rhs}
     */
    public static AssignOp assignOp(int dest, AtomicExp lhs, BinOp op, AtomicExp rhs) {
        return new AssignOp(dest, lhs, op, rhs);
    }

    /**
     * {@code dest := src}
     */
    public static AssignAtom assignAtom(int dest, AtomicExp src) {
        return new AssignAtom(dest, src);
    }

    /**
     * {@code dest := *addr}
     */
    public static Load load(int dest, AtomicExp addr) {
        return new Load(dest, addr);
    }

    /**
     * {@code *addr := value}
     */
    public static Store store(int value, AtomicExp addr) {
        return new Store(value, addr);
    }

    /**
     * {@code dest := input()}
     */
    public static Input input(int dest) {
        return new Input(dest);
    }

    /**
     * {@code output(value)}
     */
    public static Output output(int value) {
        return new Output(value);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Get whether this instruction writes an identifier.
     * <p>
     * Instructions that don't are never removed by optimisations.
     *
     * @return Whether this instruction has a {@link #dest() destination}.
     */
    public abstract boolean hasDest();

    /**
     * Get the identifier this instruction writes.
     *
     * @return The destination.
     * @throws IllegalStateException If this instruction has no destination.
     */
    public int dest() {
        throw new IllegalStateException(kind + " has no destination");
    }

    /**
     * Add the identifiers this instruction reads to {@code set}.
     *
     * @param set    The set to add to.
     * @param policy Whether address operands count as reads.
     */
    public abstract void addReadsTo(IdentSet set, OperandPolicy policy);

    static int checkIdent(int ident) {
        if (ident < 0) {
            throw new IllegalArgumentException("Negative identifier: " + ident);
        }
        return ident;
    }

    /**
     * An instruction that writes an identifier.
     */
    public static abstract class Write extends Insn {
        final int dest;

        Write(Kind kind, int dest) {
            super(kind);
            this.dest = checkIdent(dest);
        }

        @Override
        public boolean hasDest() {
            return true;
        }

        @Override
        public int dest() {
            return dest;
        }
    }

    public static final class AssignOp extends Write {
        public final AtomicExp lhs;
        public final BinOp op;
        public final AtomicExp rhs;

        private AssignOp(int dest, AtomicExp lhs, BinOp op, AtomicExp rhs) {
            super(Kind.ASSIGN_OP, dest);
            this.lhs = Objects.requireNonNull(lhs);
            this.op = Objects.requireNonNull(op);
            this.rhs = Objects.requireNonNull(rhs);
        }

        @Override
        public void addReadsTo(IdentSet set, OperandPolicy policy) {
            lhs.addReadsTo(set);
            rhs.addReadsTo(set);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof AssignOp)) return false;
            AssignOp that = (AssignOp) o;
            return dest == that.dest && lhs.equals(that.lhs) && op == that.op && rhs.equals(that.rhs);
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind(), dest, lhs, op, rhs);
        }

        @Override
        public String toString() {
            return "$" + dest + " := " + lhs + " " + op.symbol + " " + rhs;
        }
    }

    public static final class AssignAtom extends Write {
        public final AtomicExp src;

        private AssignAtom(int dest, AtomicExp src) {
            super(Kind.ASSIGN_ATOM, dest);
            this.src = Objects.requireNonNull(src);
        }

        @Override
        public void addReadsTo(IdentSet set, OperandPolicy policy) {
            src.addReadsTo(set);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof AssignAtom)) return false;
            AssignAtom that = (AssignAtom) o;
            return dest == that.dest && src.equals(that.src);
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind(), dest, src);
        }

        @Override
        public String toString() {
            return "$" + dest + " := " + src;
        }
    }

    public static final class Load extends Write {
        public final AtomicExp addr;

        private Load(int dest, AtomicExp addr) {
            super(Kind.LOAD, dest);
            this.addr = Objects.requireNonNull(addr);
        }

        @Override
        public void addReadsTo(IdentSet set, OperandPolicy policy) {
            if (policy == OperandPolicy.CONSERVATIVE) {
                addr.addReadsTo(set);
            }
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Load)) return false;
            Load that = (Load) o;
            return dest == that.dest && addr.equals(that.addr);
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind(), dest, addr);
        }

        @Override
        public String toString() {
            return "$" + dest + " := *" + addr;
        }
    }

    public static final class Input extends Write {
        private Input(int dest) {
            super(Kind.INPUT, dest);
        }

        @Override
        public void addReadsTo(IdentSet set, OperandPolicy policy) {
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Input && ((Input) o).dest == dest;
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind(), dest);
        }

        @Override
        public String toString() {
            return "$" + dest + " := input";
        }
    }

    public static final class Store extends Insn {
        public final int value;
        public final AtomicExp addr;

        private Store(int value, AtomicExp addr) {
            super(Kind.STORE);
            this.value = checkIdent(value);
            this.addr = Objects.requireNonNull(addr);
        }

        @Override
        public boolean hasDest() {
            return false;
        }

        @Override
        public void addReadsTo(IdentSet set, OperandPolicy policy) {
            set.add(value);
            if (policy == OperandPolicy.CONSERVATIVE) {
                addr.addReadsTo(set);
            }
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Store)) return false;
            Store that = (Store) o;
            return value == that.value && addr.equals(that.addr);
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind(), value, addr);
        }

        @Override
        public String toString() {
            return "*" + addr + " := $" + value;
        }
    }

    public static final class Output extends Insn {
        public final int value;

        private Output(int value) {
            super(Kind.OUTPUT);
            this.value = checkIdent(value);
        }

        @Override
        public boolean hasDest() {
            return false;
        }

        @Override
        public void addReadsTo(IdentSet set, OperandPolicy policy) {
            set.add(value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Output && ((Output) o).value == value;
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind(), value);
        }

        @Override
        public String toString() {
            return "output $" + value;
        }
    }
}
