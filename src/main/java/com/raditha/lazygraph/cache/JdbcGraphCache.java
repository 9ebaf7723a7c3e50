package com.raditha.lazygraph.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.UUID;

/**
 * Relational implementation of {@link GraphCache}.
 * <p>
 * Uses a single connection with auto-commit disabled, so writes stay pending until
 * {@link #commit()}. The {@code nodes} and {@code edges} tables are created on first use.
 * Tested against H2; the SQL is kept portable enough for PostgreSQL.
 */
public class JdbcGraphCache implements GraphCache {

    private static final Logger logger = LoggerFactory.getLogger(JdbcGraphCache.class);

    private static final String NODE_COLUMNS = "name, external_id, are_neighbors_cached, creation_date";

    private static final String CREATE_NODES = """
            CREATE TABLE IF NOT EXISTS nodes (
                name VARCHAR(255) PRIMARY KEY,
                external_id VARCHAR(255),
                are_neighbors_cached BOOLEAN NOT NULL DEFAULT FALSE,
                creation_date DATE NOT NULL
            )
            """;

    private static final String CREATE_EDGES = """
            CREATE TABLE IF NOT EXISTS edges (
                source_name VARCHAR(255) NOT NULL REFERENCES nodes(name) ON DELETE CASCADE,
                target_name VARCHAR(255) NOT NULL REFERENCES nodes(name) ON DELETE CASCADE,
                weight DOUBLE PRECISION NOT NULL,
                PRIMARY KEY (source_name, target_name),
                CONSTRAINT chk_edge_weight CHECK (weight > 0),
                CONSTRAINT chk_edge_loop CHECK (source_name <> target_name)
            )
            """;

    private final String url;
    private final Connection connection;

    public JdbcGraphCache(Connection connection, String url) throws SQLException {
        this.connection = connection;
        this.url = url;
        initialize();
    }

    /**
     * Open a cache on the database at the given JDBC URL.
     *
     * @throws GraphCacheException if the database cannot be opened or initialized
     */
    public static JdbcGraphCache open(String url, String user, String password) {
        try {
            Properties props = new Properties();
            if (user != null) {
                props.setProperty("user", user);
            }
            if (password != null) {
                props.setProperty("password", password);
            }
            return new JdbcGraphCache(DriverManager.getConnection(url, props), url);
        } catch (SQLException e) {
            throw new GraphCacheException("Failed to open graph cache at " + url, e);
        }
    }

    /**
     * Open a cache on a private in-memory H2 database that lives as long as the cache.
     */
    public static JdbcGraphCache inMemory() {
        return open("jdbc:h2:mem:lazygraph-" + UUID.randomUUID(), "sa", "");
    }

    private void initialize() throws SQLException {
        connection.setAutoCommit(false);
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(CREATE_NODES);
            stmt.execute(CREATE_EDGES);
        }
        connection.commit();
        logger.info("Opened graph cache at {}", url);
    }

    @Override
    public Optional<CachedNode> findNodeByName(String name) {
        return findNode("SELECT " + NODE_COLUMNS + " FROM nodes WHERE name = ?", name);
    }

    @Override
    public Optional<CachedNode> findNodeByExternalId(String externalId) {
        return findNode("SELECT " + NODE_COLUMNS + " FROM nodes WHERE external_id = ?", externalId);
    }

    private Optional<CachedNode> findNode(String sql, String param) {
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, param);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(toNode(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new GraphCacheException("Failed to query node " + param, e);
        }
    }

    @Override
    public CachedNode upsertNode(String name, String externalId) {
        Optional<CachedNode> existing = findNodeByName(name);
        try {
            if (existing.isEmpty()) {
                CachedNode node = new CachedNode(name, externalId, false, LocalDate.now());
                try (PreparedStatement stmt = connection.prepareStatement(
                        "INSERT INTO nodes (" + NODE_COLUMNS + ") VALUES (?, ?, ?, ?)")) {
                    stmt.setString(1, node.name());
                    stmt.setString(2, node.externalId());
                    stmt.setBoolean(3, node.neighborsCached());
                    stmt.setObject(4, node.creationDate());
                    stmt.executeUpdate();
                }
                return node;
            }
            CachedNode node = existing.get();
            if (node.externalId() == null && externalId != null) {
                try (PreparedStatement stmt = connection.prepareStatement(
                        "UPDATE nodes SET external_id = ? WHERE name = ?")) {
                    stmt.setString(1, externalId);
                    stmt.setString(2, name);
                    stmt.executeUpdate();
                }
                return new CachedNode(node.name(), externalId, node.neighborsCached(), node.creationDate());
            }
            return node;
        } catch (SQLException e) {
            throw new GraphCacheException("Failed to upsert node " + name, e);
        }
    }

    @Override
    public void setNeighborsCached(String name, boolean cached) {
        try (PreparedStatement stmt = connection.prepareStatement(
                "UPDATE nodes SET are_neighbors_cached = ? WHERE name = ?")) {
            stmt.setBoolean(1, cached);
            stmt.setString(2, name);
            if (stmt.executeUpdate() == 0) {
                throw new GraphCacheException("No cached node named " + name);
            }
        } catch (SQLException e) {
            throw new GraphCacheException("Failed to update node " + name, e);
        }
    }

    @Override
    public Optional<CachedEdge> findEdgeByNames(String nameA, String nameB) {
        String[] names = CachedEdge.canonicalOrder(nameA, nameB);
        try (PreparedStatement stmt = connection.prepareStatement(
                "SELECT weight FROM edges WHERE source_name = ? AND target_name = ?")) {
            stmt.setString(1, names[0]);
            stmt.setString(2, names[1]);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next()
                        ? Optional.of(new CachedEdge(names[0], names[1], rs.getDouble("weight")))
                        : Optional.empty();
            }
        } catch (SQLException e) {
            throw new GraphCacheException("Failed to query edge " + nameA + " -- " + nameB, e);
        }
    }

    @Override
    public void upsertEdge(String nameA, String nameB, double weight) {
        String[] names = CachedEdge.canonicalOrder(nameA, nameB);
        boolean exists = findEdgeByNames(nameA, nameB).isPresent();
        String sql = exists
                ? "UPDATE edges SET weight = ? WHERE source_name = ? AND target_name = ?"
                : "INSERT INTO edges (weight, source_name, target_name) VALUES (?, ?, ?)";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setDouble(1, weight);
            stmt.setString(2, names[0]);
            stmt.setString(3, names[1]);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new GraphCacheException("Failed to upsert edge " + nameA + " -- " + nameB, e);
        }
    }

    @Override
    public List<CachedNode> neighborsOf(String name) {
        String sql = """
                SELECT n.name, n.external_id, n.are_neighbors_cached, n.creation_date
                FROM edges e JOIN nodes n ON n.name = e.target_name
                WHERE e.source_name = ?
                UNION
                SELECT n.name, n.external_id, n.are_neighbors_cached, n.creation_date
                FROM edges e JOIN nodes n ON n.name = e.source_name
                WHERE e.target_name = ?
                """;
        List<CachedNode> result = new ArrayList<>();
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, name);
            stmt.setString(2, name);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(toNode(rs));
                }
            }
        } catch (SQLException e) {
            throw new GraphCacheException("Failed to query neighbors of " + name, e);
        }
        result.sort(Comparator.comparing(CachedNode::name));
        return result;
    }

    @Override
    public void commit() {
        try {
            connection.commit();
        } catch (SQLException e) {
            throw new GraphCacheException("Failed to commit graph cache", e);
        }
    }

    @Override
    public void rollback() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            throw new GraphCacheException("Failed to roll back graph cache", e);
        }
    }

    @Override
    public void clear() {
        try (Statement stmt = connection.createStatement()) {
            stmt.executeUpdate("DELETE FROM edges");
            stmt.executeUpdate("DELETE FROM nodes");
            connection.commit();
            logger.info("Graph cache cleared");
        } catch (SQLException e) {
            throw new GraphCacheException("Failed to clear graph cache", e);
        }
    }

    @Override
    public void close() {
        try {
            if (!connection.isClosed()) {
                connection.rollback();
                connection.close();
            }
        } catch (SQLException e) {
            throw new GraphCacheException("Failed to close graph cache", e);
        }
    }

    private static CachedNode toNode(ResultSet rs) throws SQLException {
        return new CachedNode(
                rs.getString("name"),
                rs.getString("external_id"),
                rs.getBoolean("are_neighbors_cached"),
                rs.getObject("creation_date", LocalDate.class));
    }
}
