package com.raditha.lazygraph.cache;

import java.util.List;
import java.util.Optional;

/**
 * Durable store of graph nodes and undirected edges that outlives the in-memory graph.
 * <p>
 * Writes become durable only on {@link #commit()}. Implementations are not required to be thread
 * safe; the graph serializes all access through a {@link CacheUnitOfWork}.
 */
public interface GraphCache extends AutoCloseable {

    /**
     * Find a node record by its exact name.
     */
    Optional<CachedNode> findNodeByName(String name);

    /**
     * Find a node record by its external ID.
     */
    Optional<CachedNode> findNodeByExternalId(String externalId);

    /**
     * Insert the node if no record with the given name exists.
     * An existing record keeps its neighbors-cached flag; its external ID is only filled in when it
     * had none.
     *
     * @return the stored record
     */
    CachedNode upsertNode(String name, String externalId);

    /**
     * Set the neighbors-cached flag of an existing node record.
     *
     * @throws GraphCacheException if there is no record with the given name
     */
    void setNeighborsCached(String name, boolean cached);

    /**
     * Find the edge connecting the two named nodes, in either order.
     */
    Optional<CachedEdge> findEdgeByNames(String nameA, String nameB);

    /**
     * Insert the edge between two existing node records, or update its weight.
     *
     * @throws GraphCacheException if either node record is missing
     */
    void upsertEdge(String nameA, String nameB, double weight);

    /**
     * The node records adjacent to the named node, ordered by name.
     */
    List<CachedNode> neighborsOf(String name);

    /**
     * The names of the nodes adjacent to the named node, ordered by name.
     */
    default List<String> neighborNamesOf(String name) {
        return neighborsOf(name).stream().map(CachedNode::name).toList();
    }

    /**
     * Make all pending writes durable.
     */
    void commit();

    /**
     * Discard all pending writes.
     */
    void rollback();

    /**
     * Delete every node and edge record.
     */
    void clear();

    @Override
    void close();
}
