package com.raditha.lazygraph.staticgraph;

import com.raditha.lazygraph.Graph;
import com.raditha.lazygraph.Node;

/**
 * Node of a {@link StaticGraphWrapper}, bound to a vertex of the wrapped graph.
 */
public class StaticGraphNode extends Node {

    private final StaticGraph.Vertex vertex;

    StaticGraphNode(Graph graph, int index, StaticGraph.Vertex vertex, String externalId) {
        super(graph, index, vertex.displayName(), externalId != null ? externalId : vertex.externalId());
        this.vertex = vertex;
    }

    public StaticGraph.Vertex vertex() {
        return vertex;
    }
}
