package com.raditha.lazygraph;

import com.raditha.lazygraph.cache.CachedNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Graph node that loads its neighbors lazily.
 * <p>
 * The first neighbor read goes through two stages. If the node's neighbors are not in the cache yet
 * they are fetched from the graph's {@link NeighborSource} and written to the cache. Then the cached
 * neighbor set is hydrated into the in-memory graph. Neighbors created by the hydration are not
 * resolved themselves; they load their own neighbors when they are read.
 */
public class Node {

    private static final Logger logger = LoggerFactory.getLogger(Node.class);

    private final Graph graph;
    private final int index;
    private final String name;
    private final String externalId;

    private final Map<EdgeKey, Edge> neighborEdges = new LinkedHashMap<>();
    private final ReentrantLock loadLock = new ReentrantLock();

    private volatile boolean neighborsCachedInStore;
    private volatile boolean neighborsLoadedLocally;

    public Node(Graph graph, int index, String name, String externalId) {
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
        if (index < 0) {
            throw new IllegalArgumentException("Invalid node index: " + index);
        }
        this.index = index;
        this.name = NodeNames.normalize(name);
        this.externalId = NodeNames.normalizeExternalId(externalId);
    }

    public Graph graph() {
        return graph;
    }

    public int index() {
        return index;
    }

    public String name() {
        return name;
    }

    public Optional<String> externalId() {
        return Optional.ofNullable(externalId);
    }

    /**
     * Whether this node's neighbor set has been written to the cache, by this or an earlier process.
     */
    public boolean areNeighborsCachedInStore() {
        return neighborsCachedInStore;
    }

    /**
     * Whether the cached neighbor set has been hydrated into this graph.
     */
    public boolean areNeighborsLoadedLocally() {
        return neighborsLoadedLocally;
    }

    void markNeighborsCachedInStore(boolean cached) {
        this.neighborsCachedInStore = cached;
    }

    /**
     * The number of neighbors, loading them first if needed.
     */
    public int degree() {
        resolveNeighbors();
        synchronized (neighborEdges) {
            return neighborEdges.size();
        }
    }

    /**
     * The neighbors of this node in the order they were added, loading them first if needed.
     */
    public List<Node> neighbors() {
        resolveNeighbors();
        List<Node> result = new ArrayList<>();
        synchronized (neighborEdges) {
            for (Edge edge : neighborEdges.values()) {
                result.add(edge.other(this));
            }
        }
        return result;
    }

    /**
     * The edges connecting this node to its neighbors, loading them first if needed.
     */
    public List<Edge> neighborEdges() {
        resolveNeighbors();
        synchronized (neighborEdges) {
            return List.copyOf(neighborEdges.values());
        }
    }

    /**
     * Bring this node to the fully loaded state.
     * <p>
     * Concurrent callers for the same node wait for the first one and then observe its result.
     * A call made by the loading thread itself returns immediately.
     *
     * @throws NeighborSourceException if the external source fails; the load is retried on the
     *                                 next call
     * @throws com.raditha.lazygraph.cache.GraphCacheException if the cache fails
     */
    public void resolveNeighbors() {
        if (neighborsCachedInStore && neighborsLoadedLocally) {
            return;
        }
        if (loadLock.isHeldByCurrentThread()) {
            return;
        }
        loadLock.lock();
        try {
            List<String> fetchedNames = List.of();
            if (!neighborsCachedInStore) {
                fetchedNames = loadNeighborsFromExternalSource();
            }
            if (!neighborsLoadedLocally) {
                loadNeighborsFromCache(fetchedNames);
            }
        } finally {
            loadLock.unlock();
        }
    }

    /**
     * Register an edge that has this node as one of its endpoints.
     * Registering the same edge twice has no effect. The owning edge list notifies the graph's
     * listeners once the edge is registered on both endpoints.
     *
     * @return whether the edge was new to this node
     * @throws IllegalArgumentException if the edge does not touch this node
     */
    boolean addNeighborEdge(Edge edge) {
        Objects.requireNonNull(edge, "edge must not be null");
        if (!edge.touches(this)) {
            throw new IllegalArgumentException("Tried to add a neighbor with an invalid edge: " + edge);
        }
        synchronized (neighborEdges) {
            return neighborEdges.putIfAbsent(edge.key(), edge) == null;
        }
    }

    /**
     * Fetch the neighbors from the external source and write them to the cache.
     * Only the cache is written here; the in-memory graph picks the neighbors up from the cache
     * after the write is committed.
     *
     * @return the names of the neighbors in the order the source listed them
     */
    private List<String> loadNeighborsFromExternalSource() {
        List<NeighborRef> refs = graph.neighborSource().fetchNeighbors(this);
        logger.debug("Fetched {} neighbors of {} from the external source", refs.size(), name);

        Map<String, NeighborRef> resolved = new LinkedHashMap<>();
        for (NeighborRef ref : refs) {
            Optional<String> neighborName = graph.nodes().resolveName(ref.name());
            if (neighborName.isEmpty()) {
                logger.warn("Skipping neighbor '{}' of {}: not a valid node name", ref.name(), name);
            } else if (!neighborName.get().equals(name)) {
                resolved.putIfAbsent(neighborName.get(), ref);
            }
        }

        graph.unitOfWork().write(cache -> {
            graph.unitOfWork().markDirty();
            cache.upsertNode(name, externalId);
            for (Map.Entry<String, NeighborRef> entry : resolved.entrySet()) {
                String neighborName = entry.getKey();
                cache.upsertNode(neighborName, entry.getValue().externalId());
                // An existing edge keeps its weight.
                if (cache.findEdgeByNames(name, neighborName).isEmpty()) {
                    cache.upsertEdge(name, neighborName, Edge.DEFAULT_WEIGHT);
                }
            }
            cache.setNeighborsCached(name, true);
            return null;
        });
        neighborsCachedInStore = true;
        return new ArrayList<>(resolved.keySet());
    }

    /**
     * Register the cached neighbors in memory, the freshly fetched ones first in source order.
     */
    private void loadNeighborsFromCache(List<String> fetchedNames) {
        List<CachedNode> cached = graph.unitOfWork().read(cache -> cache.neighborsOf(name));
        Map<String, CachedNode> byName = new LinkedHashMap<>();
        for (String neighborName : fetchedNames) {
            byName.put(neighborName, null);
        }
        for (CachedNode record : cached) {
            byName.put(record.name(), record);
        }

        NodeList nodes = graph.nodes();
        for (CachedNode record : byName.values()) {
            if (record == null) {
                continue;
            }
            Node neighbor = nodes.addNodeByName(record.name(), record.externalId());
            graph.edges().addEdge(this, neighbor, Edge.DEFAULT_WEIGHT, false);
        }
        neighborsLoadedLocally = true;
        logger.debug("Loaded {} cached neighbors of {}", cached.size(), name);
    }

    @Override
    public String toString() {
        return "Node[" + index + ", " + name + "]";
    }
}
