package com.raditha.lazygraph;

import java.util.List;

/**
 * External origin of neighbor data for the nodes of a {@link Graph}.
 * <p>
 * Implementations may be slow or rate limited; the graph calls {@link #fetchNeighbors(Node)} at most
 * once per node per process and only while the node's neighbors are not yet in the cache.
 */
@FunctionalInterface
public interface NeighborSource {

    /**
     * Source for graphs that rely on the cache alone.
     */
    NeighborSource NONE = node -> List.of();

    /**
     * Fetch the neighbors of the given node.
     *
     * @param node a node that already exists in the graph
     * @return the neighbor identities, never null
     * @throws NeighborSourceException if the source could not be queried
     */
    List<NeighborRef> fetchNeighbors(Node node);
}
