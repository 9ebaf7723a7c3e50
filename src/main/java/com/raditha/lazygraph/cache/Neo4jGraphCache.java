package com.raditha.lazygraph.cache;

import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.Transaction;
import org.neo4j.driver.Value;
import org.neo4j.driver.Values;
import org.neo4j.driver.exceptions.Neo4jException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Neo4j implementation of {@link GraphCache}.
 * <p>
 * Nodes are stored as {@code :GraphNode} nodes and edges as {@code :NEIGHBOR} relationships
 * pointing from the lexicographically smaller name to the larger one. All writes go through one
 * explicit transaction that is committed by {@link #commit()}.
 */
public class Neo4jGraphCache implements GraphCache {

    private static final Logger logger = LoggerFactory.getLogger(Neo4jGraphCache.class);

    private static final String NODE_LABEL = "GraphNode";
    private static final String EDGE_TYPE = "NEIGHBOR";
    private static final String RETURN_NODE = """
            RETURN n.name AS name, n.externalId AS externalId,
                   n.neighborsCached AS neighborsCached, n.creationDate AS creationDate
            """;

    private final Driver driver;
    private final String database;

    private Session session;
    private Transaction transaction;

    /**
     * Create a cache with an existing driver.
     * Useful for testing with mock drivers.
     */
    public Neo4jGraphCache(Driver driver, String database) {
        this.driver = driver;
        this.database = database;
    }

    public Neo4jGraphCache(String uri, String username, String password, String database) {
        this(GraphDatabase.driver(uri, AuthTokens.basic(username, password)), database);
        logger.info("Using Neo4j graph cache at {} (database {})", uri, database);
    }

    @Override
    public Optional<CachedNode> findNodeByName(String name) {
        return findNode("MATCH (n:%s {name: $value}) ".formatted(NODE_LABEL) + RETURN_NODE, name);
    }

    @Override
    public Optional<CachedNode> findNodeByExternalId(String externalId) {
        return findNode("MATCH (n:%s {externalId: $value}) ".formatted(NODE_LABEL) + RETURN_NODE, externalId);
    }

    private Optional<CachedNode> findNode(String cypher, String value) {
        return execute("query node " + value, () -> ensureTransaction()
                .run(cypher, Values.parameters("value", value))
                .list(Neo4jGraphCache::toNode)
                .stream()
                .findFirst());
    }

    @Override
    public CachedNode upsertNode(String name, String externalId) {
        String cypher = """
                MERGE (n:%s {name: $name})
                ON CREATE SET n.neighborsCached = false, n.creationDate = $creationDate
                SET n.externalId = coalesce(n.externalId, $externalId)
                """.formatted(NODE_LABEL) + RETURN_NODE;
        Record rec = execute("upsert node " + name, () -> ensureTransaction()
                .run(cypher, Values.parameters(
                        "name", name,
                        "externalId", externalId,
                        "creationDate", LocalDate.now()))
                .single());
        return toNode(rec);
    }

    @Override
    public void setNeighborsCached(String name, boolean cached) {
        String cypher = """
                MATCH (n:%s {name: $name})
                SET n.neighborsCached = $cached
                RETURN count(n) AS updated
                """.formatted(NODE_LABEL);
        int updated = execute("update node " + name, () -> ensureTransaction()
                .run(cypher, Values.parameters("name", name, "cached", cached))
                .single()
                .get("updated")
                .asInt());
        if (updated == 0) {
            throw new GraphCacheException("No cached node named " + name);
        }
    }

    @Override
    public Optional<CachedEdge> findEdgeByNames(String nameA, String nameB) {
        String[] names = CachedEdge.canonicalOrder(nameA, nameB);
        String cypher = """
                MATCH (a:%s {name: $source})-[r:%s]->(b:%s {name: $target})
                RETURN r.weight AS weight
                """.formatted(NODE_LABEL, EDGE_TYPE, NODE_LABEL);
        return execute("query edge " + nameA + " -- " + nameB, () -> ensureTransaction()
                .run(cypher, Values.parameters("source", names[0], "target", names[1]))
                .list(r -> new CachedEdge(names[0], names[1], r.get("weight").asDouble()))
                .stream()
                .findFirst());
    }

    @Override
    public void upsertEdge(String nameA, String nameB, double weight) {
        String[] names = CachedEdge.canonicalOrder(nameA, nameB);
        String cypher = """
                MATCH (a:%s {name: $source}), (b:%s {name: $target})
                MERGE (a)-[r:%s]->(b)
                SET r.weight = $weight
                RETURN count(r) AS written
                """.formatted(NODE_LABEL, NODE_LABEL, EDGE_TYPE);
        int written = execute("upsert edge " + nameA + " -- " + nameB, () -> ensureTransaction()
                .run(cypher, Values.parameters("source", names[0], "target", names[1], "weight", weight))
                .single()
                .get("written")
                .asInt());
        if (written == 0) {
            throw new GraphCacheException("Cannot upsert edge " + nameA + " -- " + nameB
                    + ": both nodes must be cached first");
        }
    }

    @Override
    public List<CachedNode> neighborsOf(String name) {
        String cypher = """
                MATCH (:%s {name: $name})-[:%s]-(n:%s)
                """.formatted(NODE_LABEL, EDGE_TYPE, NODE_LABEL) + RETURN_NODE + "ORDER BY name";
        return execute("query neighbors of " + name, () -> ensureTransaction()
                .run(cypher, Values.parameters("name", name))
                .list(Neo4jGraphCache::toNode));
    }

    @Override
    public void commit() {
        if (transaction == null) {
            return;
        }
        execute("commit", () -> {
            try (Transaction tx = transaction) {
                tx.commit();
            } finally {
                transaction = null;
            }
            return null;
        });
    }

    @Override
    public void rollback() {
        if (transaction == null) {
            return;
        }
        execute("roll back", () -> {
            try (Transaction tx = transaction) {
                tx.rollback();
            } finally {
                transaction = null;
            }
            return null;
        });
    }

    @Override
    public void clear() {
        execute("clear", () -> ensureTransaction()
                .run("MATCH (n:%s) DETACH DELETE n".formatted(NODE_LABEL))
                .consume());
        commit();
        logger.info("Graph cache cleared");
    }

    @Override
    public void close() {
        rollback();
        if (session != null) {
            session.close();
        }
        driver.close();
        logger.info("Neo4j graph cache closed");
    }

    private Transaction ensureTransaction() {
        if (session == null || !session.isOpen()) {
            session = driver.session(SessionConfig.forDatabase(database));
        }
        if (transaction == null || !transaction.isOpen()) {
            transaction = session.beginTransaction();
        }
        return transaction;
    }

    private <T> T execute(String operation, Supplier<T> work) {
        try {
            return work.get();
        } catch (Neo4jException e) {
            throw new GraphCacheException("Neo4j graph cache failed to " + operation, e);
        }
    }

    private static CachedNode toNode(Record rec) {
        Value externalId = rec.get("externalId");
        Value neighborsCached = rec.get("neighborsCached");
        Value creationDate = rec.get("creationDate");
        return new CachedNode(
                rec.get("name").asString(),
                externalId.isNull() ? null : externalId.asString(),
                !neighborsCached.isNull() && neighborsCached.asBoolean(),
                creationDate.isNull() ? null : creationDate.asLocalDate());
    }
}
