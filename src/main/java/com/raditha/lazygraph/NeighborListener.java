package com.raditha.lazygraph;

/**
 * Callback fired when a node receives a new neighbor.
 * Listeners run synchronously on the thread that created the edge, possibly while that thread is
 * writing to the cache. They may read the graph but must not resolve the neighbors of other nodes.
 */
@FunctionalInterface
public interface NeighborListener {

    void neighborAdded(Node node, Node neighbor);
}
