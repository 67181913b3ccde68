package io.github.eutro.liveopt.ir;

import java.util.Objects;

/**
 * An atomic expression: a value that can be read without side effects.
 */
public abstract class AtomicExp {
    private AtomicExp() {
    }

    public static Bool bool(boolean value) {
        return value ? Bool.TRUE : Bool.FALSE;
    }

    public static Num num(long value) {
        return new Num(value);
    }

    public static Ident ident(int ident) {
        return new Ident(ident);
    }

    /**
     * Add the identifier this expression reads, if any, to {@code set}.
     *
     * @param set The set to add to.
     */
    public abstract void addReadsTo(IdentSet set);

    /**
     * A boolean literal.
     */
    public static final class Bool extends AtomicExp {
        static final Bool TRUE = new Bool(true);
        static final Bool FALSE = new Bool(false);

        public final boolean value;

        private Bool(boolean value) {
            this.value = value;
        }

        @Override
        public void addReadsTo(IdentSet set) {
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Bool && ((Bool) o).value == value;
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    /**
     * A numeric literal.
     */
    public static final class Num extends AtomicExp {
        public final long value;

        private Num(long value) {
            this.value = value;
        }

        @Override
        public void addReadsTo(IdentSet set) {
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Num && ((Num) o).value == value;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(value);
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    /**
     * A reference to an identifier.
     */
    public static final class Ident extends AtomicExp {
        public final int ident;

        private Ident(int ident) {
            if (ident < 0) {
                throw new IllegalArgumentException("Negative identifier: " + ident);
            }
            this.ident = ident;
        }

        @Override
        public void addReadsTo(IdentSet set) {
            set.add(ident);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Ident && ((Ident) o).ident == ident;
        }

        @Override
        public int hashCode() {
            return Objects.hash(Ident.class, ident);
        }

        @Override
        public String toString() {
            return "$" + ident;
        }
    }
}
