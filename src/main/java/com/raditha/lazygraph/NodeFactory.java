package com.raditha.lazygraph;

/**
 * Creates the node instances of a graph.
 * Graph variants use this to validate or enrich nodes (for example by looking up a missing
 * external ID) before they are registered.
 */
@FunctionalInterface
public interface NodeFactory {

    NodeFactory DEFAULT = Node::new;

    /**
     * @param graph the graph that will own the node
     * @param index the index assigned to the node
     * @param name the trimmed, non-empty node name
     * @param externalId optional external ID, may be null
     * @return the new node
     */
    Node createNode(Graph graph, int index, String name, String externalId);
}
