package com.raditha.lazygraph;

/**
 * Unordered pair of node indices identifying an edge.
 * The pair is always stored with the smaller index first, so {@code of(3, 1)} equals {@code of(1, 3)}.
 */
public record EdgeKey(int first, int second) implements Comparable<EdgeKey> {

    public EdgeKey {
        if (first > second) {
            int swap = first;
            first = second;
            second = swap;
        }
    }

    public static EdgeKey of(int sourceIndex, int targetIndex) {
        return new EdgeKey(sourceIndex, targetIndex);
    }

    @Override
    public int compareTo(EdgeKey other) {
        int result = Integer.compare(first, other.first);
        return result != 0 ? result : Integer.compare(second, other.second);
    }
}
