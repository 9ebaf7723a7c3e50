package com.raditha.lazygraph.cache;

import com.raditha.lazygraph.config.GraphSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.Map;

/**
 * Factory for creating {@link GraphCache} instances based on configuration.
 * <p>
 * Reads the {@code cache:} section of the YAML config loaded via {@link GraphSettings}:
 * <pre>
 * cache:
 *   type: jdbc           # or "neo4j"
 *   reset: false         # clear the cache after opening it
 *   jdbc:
 *     url: jdbc:h2:./lazygraph-cache
 *     user: sa
 *     password: ""
 *   neo4j:
 *     uri: bolt://localhost:7687
 *     username: neo4j
 *     password: secret
 *     database: neo4j
 * </pre>
 */
public class GraphCacheFactory {

    private static final Logger logger = LoggerFactory.getLogger(GraphCacheFactory.class);

    public static final String CACHE_KEY = "cache";

    private static final String DEFAULT_TYPE = "jdbc";

    // JDBC defaults
    private static final String DEFAULT_JDBC_URL = "jdbc:h2:./lazygraph-cache";
    private static final String DEFAULT_JDBC_USER = "sa";

    // Neo4j defaults
    private static final String DEFAULT_NEO4J_URI = "bolt://localhost:7687";
    private static final String DEFAULT_NEO4J_USERNAME = "neo4j";
    private static final String DEFAULT_NEO4J_DATABASE = "neo4j";

    private GraphCacheFactory() {
    }

    /**
     * Create a GraphCache from a configuration file.
     * Loads the file into GraphSettings, then reads the {@code cache:} section.
     */
    public static GraphCache createGraphCache(File configFile) throws IOException {
        GraphSettings.loadConfigMap(configFile);
        return createGraphCache();
    }

    /**
     * Create a GraphCache from already-loaded GraphSettings.
     *
     * @throws GraphCacheException if the cache cannot be opened
     */
    public static GraphCache createGraphCache() {
        Map<String, Object> cacheConfig = GraphSettings.getSection(CACHE_KEY);

        String type = GraphSettings.getString(cacheConfig, "type", DEFAULT_TYPE);
        logger.info("Creating {} graph cache", type);

        GraphCache cache;
        if ("neo4j".equalsIgnoreCase(type)) {
            cache = createNeo4jCache(GraphSettings.getSection(cacheConfig, "neo4j"));
        } else if (DEFAULT_TYPE.equalsIgnoreCase(type)) {
            cache = createJdbcCache(GraphSettings.getSection(cacheConfig, "jdbc"));
        } else {
            throw new IllegalArgumentException("Unknown graph cache type: " + type);
        }

        if (GraphSettings.getBoolean(cacheConfig, "reset", false)) {
            cache.clear();
        }
        return cache;
    }

    private static GraphCache createJdbcCache(Map<String, Object> jdbcConfig) {
        String url = GraphSettings.getString(jdbcConfig, "url", DEFAULT_JDBC_URL);
        String user = GraphSettings.getString(jdbcConfig, "user", DEFAULT_JDBC_USER);
        String password = GraphSettings.getString(jdbcConfig, "password", "");

        return JdbcGraphCache.open(url, user, password);
    }

    private static GraphCache createNeo4jCache(Map<String, Object> neo4jConfig) {
        String uri = GraphSettings.getString(neo4jConfig, "uri", DEFAULT_NEO4J_URI);
        String username = GraphSettings.getString(neo4jConfig, "username", DEFAULT_NEO4J_USERNAME);
        String password = GraphSettings.getString(neo4jConfig, "password", "");
        String database = GraphSettings.getString(neo4jConfig, "database", DEFAULT_NEO4J_DATABASE);

        return new Neo4jGraphCache(uri, username, password, database);
    }
}
