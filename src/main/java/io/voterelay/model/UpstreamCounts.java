package io.voterelay.model;

import java.util.Arrays;

/**
 * How many delegators reach a signer through stored edges, per distance.
 * Distance 1 counts direct delegators, distance 2 their delegators, and so on.
 * Instances are immutable.
 */
public final class UpstreamCounts {
    private static final UpstreamCounts EMPTY = new UpstreamCounts(new int[0]);

    // counts[d - 1] holds the count at distance d; no trailing zeros
    private final int[] counts;

    private UpstreamCounts(int[] counts) {
        this.counts = counts;
    }

    public static UpstreamCounts empty() {
        return EMPTY;
    }

    /**
     * Builds counts from values at distances 1, 2, ... in order.
     */
    public static UpstreamCounts of(int... byDistance) {
        int[] copy = byDistance == null ? new int[0] : byDistance.clone();
        for (int i = 0; i < copy.length; i++) {
            if (copy[i] < 0) {
                throw new IllegalArgumentException("count at distance " + (i + 1) + " is negative: " + copy[i]);
            }
        }
        return trimmed(copy);
    }

    public int count(int distance) {
        if (distance < 1) {
            throw new IllegalArgumentException("distance must be positive, got " + distance);
        }
        return distance <= counts.length ? counts[distance - 1] : 0;
    }

    /**
     * Longest distance at which some delegator reaches this signer, 0 when none does.
     */
    public int depth() {
        return counts.length;
    }

    public boolean isEmpty() {
        return counts.length == 0;
    }

    /**
     * Counts carried across one edge leaving this signer: the signer itself at
     * distance 1 plus every upstream delegator one step further away.
     */
    public UpstreamCounts throughEdge() {
        int[] out = new int[counts.length + 1];
        out[0] = 1;
        System.arraycopy(counts, 0, out, 1, counts.length);
        return new UpstreamCounts(out);
    }

    /**
     * Adds {@code other}, moved {@code shift} distances further away.
     */
    public UpstreamCounts plus(UpstreamCounts other, int shift) {
        return combine(other, shift, 1);
    }

    /**
     * Removes {@code other}, moved {@code shift} distances further away.
     *
     * @throws IllegalStateException if a count would drop below zero
     */
    public UpstreamCounts minus(UpstreamCounts other, int shift) {
        return combine(other, shift, -1);
    }

    public int[] toArray() {
        return counts.clone();
    }

    private UpstreamCounts combine(UpstreamCounts other, int shift, int sign) {
        if (shift < 0) {
            throw new IllegalArgumentException("shift must not be negative, got " + shift);
        }
        if (other.isEmpty()) {
            return this;
        }
        int[] out = Arrays.copyOf(counts, Math.max(counts.length, other.counts.length + shift));
        for (int i = 0; i < other.counts.length; i++) {
            int at = i + shift;
            out[at] += sign * other.counts[i];
            if (out[at] < 0) {
                throw new IllegalStateException("upstream count at distance " + (at + 1) + " dropped below zero");
            }
        }
        return trimmed(out);
    }

    private static UpstreamCounts trimmed(int[] values) {
        int length = values.length;
        while (length > 0 && values[length - 1] == 0) {
            length--;
        }
        if (length == 0) {
            return EMPTY;
        }
        return new UpstreamCounts(length == values.length ? values : Arrays.copyOf(values, length));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UpstreamCounts)) {
            return false;
        }
        return Arrays.equals(counts, ((UpstreamCounts) o).counts);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(counts);
    }

    @Override
    public String toString() {
        return Arrays.toString(counts);
    }
}
