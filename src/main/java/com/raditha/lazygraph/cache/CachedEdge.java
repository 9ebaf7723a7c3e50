package com.raditha.lazygraph.cache;

/**
 * Persisted undirected edge record. The source name always sorts before the target name.
 */
public record CachedEdge(String sourceName, String targetName, double weight) {

    public CachedEdge {
        if (sourceName.compareTo(targetName) > 0) {
            String swap = sourceName;
            sourceName = targetName;
            targetName = swap;
        }
    }

    /**
     * Orders a pair of names the way edges are stored.
     *
     * @return a two element array, smaller name first
     */
    public static String[] canonicalOrder(String nameA, String nameB) {
        return nameA.compareTo(nameB) <= 0
                ? new String[] {nameA, nameB}
                : new String[] {nameB, nameA};
    }
}
