package com.raditha.lazygraph.staticgraph;

import com.raditha.lazygraph.Graph;
import com.raditha.lazygraph.NeighborRef;
import com.raditha.lazygraph.NeighborSource;
import com.raditha.lazygraph.Node;
import com.raditha.lazygraph.NodeFactory;
import com.raditha.lazygraph.cache.JdbcGraphCache;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Lazily loaded view of a {@link StaticGraph}.
 * <p>
 * The wrapper owns a private in-memory cache, so nothing outlives it. The wrapped graph acts as
 * the external neighbor source. Node names are vertex names, or vertex indices for unnamed
 * vertices; numeric names are accepted as indices when validating user input.
 */
public class StaticGraphWrapper extends Graph implements AutoCloseable {

    private final StaticGraph wrappedGraph;

    public StaticGraphWrapper(StaticGraph wrappedGraph) {
        super(openCache(wrappedGraph), nodeFactory(wrappedGraph), neighborSource(wrappedGraph));
        this.wrappedGraph = wrappedGraph;
    }

    public StaticGraph wrappedGraph() {
        return wrappedGraph;
    }

    @Override
    public Optional<String> getAuthenticNodeName(String name) {
        return wrappedGraph.resolve(name).map(StaticGraph.Vertex::displayName);
    }

    @Override
    public void close() {
        cache().close();
    }

    private static JdbcGraphCache openCache(StaticGraph wrappedGraph) {
        Objects.requireNonNull(wrappedGraph, "wrappedGraph must not be null");
        return JdbcGraphCache.inMemory();
    }

    private static NodeFactory nodeFactory(StaticGraph wrappedGraph) {
        return (graph, index, name, externalId) -> {
            StaticGraph.Vertex vertex = wrappedGraph.resolve(name)
                    .filter(v -> v.displayName().equals(name))
                    .orElseThrow(() -> new IllegalArgumentException(
                            "The wrapped graph has no vertex named " + name));
            return new StaticGraphNode(graph, index, vertex, externalId);
        };
    }

    private static NeighborSource neighborSource(StaticGraph wrappedGraph) {
        return node -> {
            List<NeighborRef> refs = new ArrayList<>();
            for (StaticGraph.Vertex neighbor : wrappedGraph.neighbors(vertexOf(node).index())) {
                refs.add(new NeighborRef(neighbor.displayName(), neighbor.externalId()));
            }
            return refs;
        };
    }

    private static StaticGraph.Vertex vertexOf(Node node) {
        if (node instanceof StaticGraphNode staticNode) {
            return staticNode.vertex();
        }
        throw new IllegalArgumentException("Not a node of a static graph wrapper: " + node);
    }
}
