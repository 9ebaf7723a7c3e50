package com.raditha.lazygraph;

import com.raditha.lazygraph.cache.CachedEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry of the edges of a graph, keyed by the unordered pair of endpoint indices.
 */
public class EdgeList {

    private static final Logger logger = LoggerFactory.getLogger(EdgeList.class);

    private final Graph graph;
    private final Map<EdgeKey, Edge> edges = new TreeMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    EdgeList(Graph graph) {
        this.graph = graph;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return edges.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Snapshot of all edges ordered by their index-pair key.
     */
    public List<Edge> edges() {
        lock.readLock().lock();
        try {
            return List.copyOf(edges.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Add an edge between the given nodes unless they are the same node or are already connected.
     * A persisted edge is registered in memory only after the cache accepted it.
     *
     * @param source one endpoint
     * @param target the other endpoint
     * @param weight the edge weight, must be positive
     * @param persistToCache whether a newly created edge is also written to the cache
     * @return the new edge, or empty if no edge was created
     * @throws IllegalArgumentException if the weight is not positive or a node belongs to another graph
     * @throws com.raditha.lazygraph.cache.GraphCacheException if the edge cannot be persisted
     */
    public Optional<Edge> addEdge(Node source, Node target, double weight, boolean persistToCache) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Edge.validateWeight(weight);
        if (source.graph() != graph || target.graph() != graph) {
            throw new IllegalArgumentException("Both endpoints must belong to this graph");
        }
        if (source.index() == target.index()) {
            return Optional.empty();
        }

        EdgeKey key = EdgeKey.of(source.index(), target.index());
        Edge edge;
        lock.writeLock().lock();
        try {
            if (edges.containsKey(key)) {
                return Optional.empty();
            }
            if (persistToCache) {
                persistEdge(source, target, weight);
            }
            edge = new Edge(source, target, weight);
            edges.put(key, edge);
        } finally {
            lock.writeLock().unlock();
        }
        // Listeners may read the graph, so they run outside the registry lock.
        graph.fireNeighborAdded(source, target);
        graph.fireNeighborAdded(target, source);
        return Optional.of(edge);
    }

    /**
     * Write the edge between two nodes to the cache: insert it if missing, update its weight if it
     * differs. Commits only if something was written.
     *
     * @return whether the cache was changed
     */
    boolean persistEdge(Node source, Node target, double weight) {
        return graph.unitOfWork().write(cache -> {
            Optional<CachedEdge> existing = cache.findEdgeByNames(source.name(), target.name());
            if (existing.isPresent() && existing.get().weight() == weight) {
                return false;
            }
            graph.unitOfWork().markDirty();
            cache.upsertEdge(source.name(), target.name(), weight);
            logger.debug("Persisted edge {} -- {} ({})", source.name(), target.name(), weight);
            return true;
        });
    }

    public Optional<Edge> getEdge(Node source, Node target) {
        return getEdgeByIndex(source.index(), target.index());
    }

    /**
     * Returns the edge connecting the nodes with the given indices, in either order.
     */
    public Optional<Edge> getEdgeByIndex(int sourceIndex, int targetIndex) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(edges.get(EdgeKey.of(sourceIndex, targetIndex)));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the edge connecting the nodes with the given names, in either order.
     * The names are resolved through the node list, so nodes known only to the cache are
     * registered as a side effect.
     */
    public Optional<Edge> getEdgeByName(String sourceName, String targetName) {
        NodeList nodes = graph.nodes();
        Optional<Node> source = nodes.getNodeByName(sourceName);
        if (source.isEmpty()) {
            return Optional.empty();
        }
        Optional<Node> target = nodes.getNodeByName(targetName);
        if (target.isEmpty()) {
            return Optional.empty();
        }
        return getEdge(source.get(), target.get());
    }
}
