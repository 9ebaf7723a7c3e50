package com.raditha.lazygraph;

import com.raditha.lazygraph.cache.CacheUnitOfWork;
import com.raditha.lazygraph.cache.GraphCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Undirected graph that loads its nodes and edges on demand and caches them in a {@link GraphCache}.
 * <p>
 * The graph binds together a {@link NodeList}, an {@link EdgeList}, the cache and the external
 * {@link NeighborSource}. The cache is shared with the caller, who is responsible for closing it.
 * <p>
 * Graph variants backed by a particular data source override {@link #getAuthenticNodeName(String)}
 * to turn user supplied, possibly inexact names into the names the source knows.
 */
public class Graph {

    private static final Logger logger = LoggerFactory.getLogger(Graph.class);

    private final CacheUnitOfWork unitOfWork;
    private final NeighborSource neighborSource;
    private final NodeList nodes;
    private final EdgeList edges;
    private final List<NeighborListener> neighborListeners = new CopyOnWriteArrayList<>();

    /**
     * Create a graph that relies on the cache alone.
     */
    public Graph(GraphCache cache) {
        this(cache, NodeFactory.DEFAULT, NeighborSource.NONE);
    }

    public Graph(GraphCache cache, NodeFactory nodeFactory, NeighborSource neighborSource) {
        Objects.requireNonNull(cache, "cache must not be null");
        this.unitOfWork = new CacheUnitOfWork(cache);
        this.neighborSource = Objects.requireNonNull(neighborSource, "neighborSource must not be null");
        this.nodes = new NodeList(this, Objects.requireNonNull(nodeFactory, "nodeFactory must not be null"));
        this.edges = new EdgeList(this);
    }

    public NodeList nodes() {
        return nodes;
    }

    public EdgeList edges() {
        return edges;
    }

    public GraphCache cache() {
        return unitOfWork.cache();
    }

    CacheUnitOfWork unitOfWork() {
        return unitOfWork;
    }

    NeighborSource neighborSource() {
        return neighborSource;
    }

    /**
     * Add the node with the given name unless it already exists in the graph or in the cache.
     *
     * @return the existing or the new node
     */
    public Node addNode(String name) {
        return addNode(name, null);
    }

    public Node addNode(String name, String externalId) {
        return nodes.addNodeByName(name, externalId);
    }

    /**
     * Connect two nodes with an edge of default weight.
     *
     * @see #addEdge(String, String, double)
     */
    public Optional<Edge> addEdge(String sourceName, String targetName) {
        return addEdge(sourceName, targetName, Edge.DEFAULT_WEIGHT);
    }

    /**
     * Connect the nodes with the given names and persist the edge.
     * Nothing happens if either node does not exist or the nodes are already connected.
     *
     * @return the new edge, or empty if no edge was created
     * @throws IllegalArgumentException if the weight is not positive or both names are the same
     */
    public Optional<Edge> addEdge(String sourceName, String targetName, double weight) {
        Edge.validateWeight(weight);
        String source = NodeNames.normalize(sourceName);
        String target = NodeNames.normalize(targetName);
        if (source.equals(target)) {
            throw new IllegalArgumentException("Creating a loop edge is not allowed: " + source);
        }
        Optional<Node> sourceNode = nodes.getNodeByName(source);
        Optional<Node> targetNode = nodes.getNodeByName(target);
        if (sourceNode.isEmpty() || targetNode.isEmpty()) {
            logger.debug("Not adding edge {} -- {}: unknown endpoint", source, target);
            return Optional.empty();
        }
        return addEdge(sourceNode.get(), targetNode.get(), weight, true);
    }

    /**
     * Connect the nodes with the given indices and persist the edge.
     * Nothing happens if either node does not exist or the nodes are already connected.
     *
     * @throws IllegalArgumentException if the weight is not positive or both indices are the same
     */
    public Optional<Edge> addEdgeByIndex(int sourceIndex, int targetIndex, double weight) {
        Edge.validateWeight(weight);
        if (sourceIndex == targetIndex) {
            throw new IllegalArgumentException("Creating a loop edge is not allowed: " + sourceIndex);
        }
        Optional<Node> source = nodes.getNode(sourceIndex);
        Optional<Node> target = nodes.getNode(targetIndex);
        if (source.isEmpty() || target.isEmpty()) {
            return Optional.empty();
        }
        return addEdge(source.get(), target.get(), weight, true);
    }

    /**
     * Connect two nodes of this graph.
     *
     * @param persistToCache false when the edge is being loaded from the cache
     */
    public Optional<Edge> addEdge(Node source, Node target, double weight, boolean persistToCache) {
        if (source.graph() != this || target.graph() != this) {
            throw new IllegalArgumentException("Both endpoints must belong to this graph");
        }
        if (edges.getEdge(source, target).isPresent()) {
            return Optional.empty();
        }
        return edges.addEdge(source, target, weight, persistToCache);
    }

    /**
     * Returns the exact name of the node that corresponds to the given name, if such a node exists
     * in the graph or in the cache.
     * <p>
     * Graph variants where users may enter inexact names should override this method to query
     * their data source.
     *
     * @param name the candidate name
     * @return the authentic node name, or empty if the name does not denote a node
     */
    public Optional<String> getAuthenticNodeName(String name) {
        return nodes.getNodeByName(name).map(Node::name);
    }

    /**
     * Whether {@link #getAuthenticNodeName(String)} resolves the given name.
     */
    public boolean nodeExists(String name) {
        return getAuthenticNodeName(name).isPresent();
    }

    public void addNeighborListener(NeighborListener listener) {
        neighborListeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeNeighborListener(NeighborListener listener) {
        neighborListeners.remove(listener);
    }

    void fireNeighborAdded(Node node, Node neighbor) {
        for (NeighborListener listener : neighborListeners) {
            listener.neighborAdded(node, neighbor);
        }
    }
}
