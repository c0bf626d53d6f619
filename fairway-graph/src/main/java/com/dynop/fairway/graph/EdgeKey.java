package com.dynop.fairway.graph;

import java.util.Objects;

/**
 * Unordered pair of node ids identifying an undirected edge.
 *
 * <p>{@code EdgeKey.of("a", "b")} and {@code EdgeKey.of("b", "a")} are equal.
 */
public final class EdgeKey {

    private final String low;
    private final String high;

    private EdgeKey(String low, String high) {
        this.low = low;
        this.high = high;
    }

    public static EdgeKey of(String u, String v) {
        Objects.requireNonNull(u, "u");
        Objects.requireNonNull(v, "v");
        return u.compareTo(v) <= 0 ? new EdgeKey(u, v) : new EdgeKey(v, u);
    }

    public boolean contains(String nodeId) {
        return low.equals(nodeId) || high.equals(nodeId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EdgeKey that = (EdgeKey) o;
        return low.equals(that.low) && high.equals(that.high);
    }

    @Override
    public int hashCode() {
        return Objects.hash(low, high);
    }

    @Override
    public String toString() {
        return "(" + low + ", " + high + ")";
    }
}
