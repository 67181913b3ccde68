package io.github.eutro.liveopt.ir;

import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * A mutable set of identifiers.
 * <p>
 * Identifiers are non-negative, and are usually small and dense within one {@link Cfg},
 * so those below {@link #DENSE_LIMIT} are kept in a {@link BitSet}. Larger ones are kept
 * in a sorted set, so memory use depends on how many identifiers there are, not on how big.
 */
public final class IdentSet implements Iterable<Integer> {
    /**
     * Identifiers below this are stored as bits.
     */
    public static final int DENSE_LIMIT = 1 << 16;

    private final BitSet dense;
    private final TreeSet<Integer> sparse;

    private IdentSet(BitSet dense, TreeSet<Integer> sparse) {
        this.dense = dense;
        this.sparse = sparse;
    }

    /**
     * Create a new, empty set.
     */
    public IdentSet() {
        this(new BitSet(), new TreeSet<>());
    }

    /**
     * Create a new set with the given identifiers.
     *
     * @param idents The identifiers.
     * @return The set.
     */
    public static IdentSet of(int... idents) {
        IdentSet set = new IdentSet();
        for (int ident : idents) {
            set.add(ident);
        }
        return set;
    }

    private static int check(int ident) {
        if (ident < 0) {
            throw new IllegalArgumentException("Negative identifier: " + ident);
        }
        return ident;
    }

    /**
     * Add an identifier.
     *
     * @param ident The identifier.
     * @return Whether the set changed.
     */
    public boolean add(int ident) {
        if (check(ident) >= DENSE_LIMIT) return sparse.add(ident);
        if (dense.get(ident)) return false;
        dense.set(ident);
        return true;
    }

    /**
     * Remove an identifier.
     *
     * @param ident The identifier.
     * @return Whether the set changed.
     */
    public boolean remove(int ident) {
        if (check(ident) >= DENSE_LIMIT) return sparse.remove(ident);
        if (!dense.get(ident)) return false;
        dense.clear(ident);
        return true;
    }

    public boolean contains(int ident) {
        if (check(ident) >= DENSE_LIMIT) return sparse.contains(ident);
        return dense.get(ident);
    }

    /**
     * Add every identifier of {@code other} to this set.
     *
     * @param other The other set.
     * @return Whether this set changed.
     */
    public boolean addAll(IdentSet other) {
        int before = dense.cardinality();
        dense.or(other.dense);
        boolean changed = sparse.addAll(other.sparse);
        return changed || dense.cardinality() != before;
    }

    /**
     * Remove every identifier of {@code other} from this set.
     *
     * @param other The other set.
     * @return Whether this set changed.
     */
    public boolean removeAll(IdentSet other) {
        int before = dense.cardinality();
        dense.andNot(other.dense);
        boolean changed = !sparse.isEmpty() && sparse.removeAll(other.sparse);
        return changed || dense.cardinality() != before;
    }

    /**
     * Compute the union of this and {@code other}, as a new set.
     *
     * @param other The other set.
     * @return The union.
     */
    public IdentSet union(IdentSet other) {
        IdentSet result = copy();
        result.addAll(other);
        return result;
    }

    /**
     * Compute this set without the identifiers of {@code other}, as a new set.
     *
     * @param other The other set.
     * @return The difference.
     */
    public IdentSet minus(IdentSet other) {
        IdentSet result = copy();
        result.removeAll(other);
        return result;
    }

    /**
     * Check whether every identifier in this set is also in {@code other}.
     *
     * @param other The other set.
     * @return Whether this is a subset of {@code other}.
     */
    public boolean isSubsetOf(IdentSet other) {
        if (!other.sparse.containsAll(sparse)) return false;
        BitSet missing = (BitSet) dense.clone();
        missing.andNot(other.dense);
        return missing.isEmpty();
    }

    public boolean isEmpty() {
        return dense.isEmpty() && sparse.isEmpty();
    }

    public int size() {
        return dense.cardinality() + sparse.size();
    }

    public IdentSet copy() {
        return new IdentSet((BitSet) dense.clone(), new TreeSet<>(sparse));
    }

    /**
     * Iterates over the identifiers in ascending order.
     * <p>
     * The set must not be modified during iteration.
     */
    @NotNull
    @Override
    public Iterator<Integer> iterator() {
        return new Iterator<Integer>() {
            int next = dense.nextSetBit(0);
            final Iterator<Integer> rest = sparse.iterator();

            @Override
            public boolean hasNext() {
                return next >= 0 || rest.hasNext();
            }

            @Override
            public Integer next() {
                if (next < 0) return rest.next();
                int current = next;
                next = current + 1 < DENSE_LIMIT ? dense.nextSetBit(current + 1) : -1;
                return current;
            }
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IdentSet that = (IdentSet) o;
        return dense.equals(that.dense) && sparse.equals(that.sparse);
    }

    @Override
    public int hashCode() {
        return 31 * dense.hashCode() + sparse.hashCode();
    }

    @Override
    public String toString() {
        StringJoiner sj = new StringJoiner(", ", "{", "}");
        for (int ident : this) {
            sj.add(Integer.toString(ident));
        }
        return sj.toString();
    }
}
