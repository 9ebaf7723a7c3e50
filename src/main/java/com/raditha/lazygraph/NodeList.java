package com.raditha.lazygraph;

import com.raditha.lazygraph.cache.CachedNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry of the nodes of a graph, indexed by creation order and by name.
 * <p>
 * Name lookups fall through from the in-memory registry to the graph's cache, and optionally to the
 * graph's name validation. Nodes materialized from the cache keep the cache's neighbors-cached flag
 * but do not load their neighbors; that happens when their neighbors are first read.
 */
public class NodeList {

    private static final Logger logger = LoggerFactory.getLogger(NodeList.class);

    private final Graph graph;
    private final NodeFactory nodeFactory;

    private final List<Node> nodesByIndex = new ArrayList<>();
    private final Map<String, Node> nodesByName = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    NodeList(Graph graph, NodeFactory nodeFactory) {
        this.graph = graph;
        this.nodeFactory = nodeFactory;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return nodesByIndex.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Snapshot of all nodes ordered by index.
     */
    public List<Node> nodes() {
        lock.readLock().lock();
        try {
            return List.copyOf(nodesByIndex);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the node with the given index if it currently exists in this list.
     */
    public Optional<Node> getNode(int index) {
        lock.readLock().lock();
        try {
            return index >= 0 && index < nodesByIndex.size()
                    ? Optional.of(nodesByIndex.get(index))
                    : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the node with the given name if it exists in memory or in the cache.
     */
    public Optional<Node> getNodeByName(String name) {
        return getNodeByName(name, false, null);
    }

    /**
     * Resolve a node by name.
     * <ol>
     *     <li>A node registered in memory is returned as is.</li>
     *     <li>A node found in the cache is registered in memory and returned.</li>
     *     <li>Otherwise, if {@code canValidateAndLoad} is set, the graph's
     *     {@link Graph#getAuthenticNodeName(String)} is asked for the canonical name, and the node
     *     with that name is taken from memory, from the cache, or created and persisted with the
     *     given external ID.</li>
     * </ol>
     *
     * @param name the name to resolve
     * @param canValidateAndLoad whether unknown names may be validated and loaded
     * @param externalId external ID used only when a new node is created in step 3
     * @return the node, or empty if the name does not denote one
     * @throws IllegalArgumentException if the name is null or blank
     */
    public Optional<Node> getNodeByName(String name, boolean canValidateAndLoad, String externalId) {
        String nodeName = NodeNames.normalize(name);

        Optional<Node> node = findLocal(nodeName);
        if (node.isPresent()) {
            return node;
        }

        Optional<CachedNode> cached = graph.unitOfWork().read(cache -> cache.findNodeByName(nodeName));
        if (cached.isPresent()) {
            return Optional.of(materialize(cached.get()));
        }
        if (!canValidateAndLoad) {
            return Optional.empty();
        }

        Optional<String> authentic = graph.getAuthenticNodeName(nodeName);
        if (authentic.isEmpty()) {
            logger.debug("'{}' does not denote a node", nodeName);
            return Optional.empty();
        }
        String authenticName = NodeNames.normalize(authentic.get());
        node = findLocal(authenticName);
        if (node.isPresent()) {
            return node;
        }
        return Optional.of(loadOrInsert(authenticName, externalId));
    }

    /**
     * Add a node with the given name unless a node with that name already exists in memory or in
     * the cache. New nodes are persisted with their neighbors marked as not cached.
     *
     * @return the existing or the new node
     * @throws IllegalArgumentException if the name is null or blank
     * @throws com.raditha.lazygraph.cache.GraphCacheException if the node cannot be persisted; the
     *                                 node is then not registered either
     */
    public Node addNodeByName(String name, String externalId) {
        String nodeName = NodeNames.normalize(name);
        Optional<Node> existing = findLocal(nodeName);
        if (existing.isPresent()) {
            return existing.get();
        }
        return loadOrInsert(nodeName, externalId);
    }

    /**
     * Canonical name of the node the given name denotes, found in memory, in the cache or through
     * the graph's name validation. Nothing is registered or persisted.
     */
    Optional<String> resolveName(String name) {
        String nodeName = NodeNames.normalize(name);
        if (findLocal(nodeName).isPresent()
                || graph.unitOfWork().read(cache -> cache.findNodeByName(nodeName)).isPresent()) {
            return Optional.of(nodeName);
        }
        return graph.getAuthenticNodeName(nodeName).map(NodeNames::normalize);
    }

    private Optional<Node> findLocal(String name) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(nodesByName.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Register a node for a cache record without writing anything back.
     */
    private Node materialize(CachedNode record) {
        return register(record.name(), record.externalId(), record.neighborsCached());
    }

    /**
     * Register the node with the given name from its cache record, or persist a new record and
     * register the node once the record is written.
     */
    private Node loadOrInsert(String name, String externalId) {
        lock.writeLock().lock();
        try {
            Node existing = nodesByName.get(name);
            if (existing != null) {
                return existing;
            }
            Optional<CachedNode> record = graph.unitOfWork().read(cache -> cache.findNodeByName(name));
            if (record.isPresent()) {
                return materialize(record.get());
            }
            Node node = createNode(name, externalId);
            graph.unitOfWork().write(cache -> {
                graph.unitOfWork().markDirty();
                return cache.upsertNode(node.name(), node.externalId().orElse(null));
            });
            add(node, false);
            logger.debug("Created node {}", node);
            return node;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Node register(String name, String externalId, boolean neighborsCached) {
        lock.writeLock().lock();
        try {
            Node existing = nodesByName.get(name);
            if (existing != null) {
                return existing;
            }
            Node node = createNode(name, externalId);
            add(node, neighborsCached);
            return node;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Create the node for the next free index. Callers hold the write lock.
     */
    private Node createNode(String name, String externalId) {
        int index = nodesByIndex.size();
        Node node = nodeFactory.createNode(graph, index, name, externalId);
        if (node.index() != index || !node.name().equals(name)) {
            throw new IllegalStateException("Node factory returned " + node
                    + " for index " + index + " and name " + name);
        }
        return node;
    }

    private void add(Node node, boolean neighborsCached) {
        node.markNeighborsCachedInStore(neighborsCached);
        nodesByIndex.add(node);
        nodesByName.put(node.name(), node);
    }
}
