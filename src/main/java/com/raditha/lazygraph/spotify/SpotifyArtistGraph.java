package com.raditha.lazygraph.spotify;

import com.raditha.lazygraph.Graph;
import com.raditha.lazygraph.NeighborRef;
import com.raditha.lazygraph.NeighborSource;
import com.raditha.lazygraph.Node;
import com.raditha.lazygraph.NodeFactory;
import com.raditha.lazygraph.cache.GraphCache;
import com.raditha.lazygraph.cache.GraphCacheFactory;
import com.raditha.lazygraph.config.GraphSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Graph of Spotify artists where two artists are neighbors if Spotify lists them as related.
 * <p>
 * Every node carries the artist's Spotify ID as its external ID. Names entered by users are
 * resolved through Spotify's artist search.
 */
public class SpotifyArtistGraph extends Graph implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SpotifyArtistGraph.class);

    public static final String SPOTIFY_KEY = "spotify";
    public static final int DEFAULT_NEIGHBOR_COUNT = 6;

    static final String CLIENT_ID_ENV = "SPOTIFY_CLIENT_ID";
    static final String CLIENT_SECRET_ENV = "SPOTIFY_CLIENT_SECRET";

    private final SpotifyClient client;
    private final int neighborCount;

    /**
     * @param client the Spotify client to use
     * @param neighborCount the maximum number of related artists loaded per artist; non-positive
     *                      values select {@link #DEFAULT_NEIGHBOR_COUNT}
     * @param cache the cache to use; closed by {@link #close()}
     */
    public SpotifyArtistGraph(SpotifyClient client, int neighborCount, GraphCache cache) {
        super(cache, nodeFactory(client), neighborSource(client, effectiveNeighborCount(neighborCount)));
        this.client = client;
        this.neighborCount = effectiveNeighborCount(neighborCount);
    }

    /**
     * Create a graph from the {@code spotify:} and {@code cache:} sections of the loaded
     * {@link GraphSettings}. Credentials missing from the configuration are taken from the
     * {@code SPOTIFY_CLIENT_ID} and {@code SPOTIFY_CLIENT_SECRET} environment variables.
     *
     * @throws IllegalStateException if no credentials are configured
     */
    public static SpotifyArtistGraph fromSettings() {
        Map<String, Object> config = GraphSettings.getSection(SPOTIFY_KEY);
        String clientId = getConfigString(config, "client_id", CLIENT_ID_ENV);
        String clientKey = getConfigString(config, "client_key", CLIENT_SECRET_ENV);
        if (clientId == null || clientKey == null) {
            throw new IllegalStateException("Spotify credentials are required. Configure spotify.client_id and "
                    + "spotify.client_key in graph.yml or set " + CLIENT_ID_ENV + " and " + CLIENT_SECRET_ENV);
        }
        int neighborCount = GraphSettings.getInt(config, "neighbor_count", DEFAULT_NEIGHBOR_COUNT);
        return new SpotifyArtistGraph(new SpotifyClient(clientId, clientKey), neighborCount,
                GraphCacheFactory.createGraphCache());
    }

    static String getConfigString(Map<String, Object> config, String key, String envName) {
        String value = GraphSettings.getString(config, key, null);
        if (value != null && !value.trim().isEmpty()) {
            return value.trim();
        }
        String envValue = System.getenv(envName);
        if (envValue != null && !envValue.trim().isEmpty()) {
            return envValue.trim();
        }
        return null;
    }

    public SpotifyClient client() {
        return client;
    }

    public int neighborCount() {
        return neighborCount;
    }

    /**
     * Returns the name of the best matching Spotify artist.
     */
    @Override
    public Optional<String> getAuthenticNodeName(String name) {
        List<NeighborRef> items = client.searchArtistsByName(name);
        return items.isEmpty() ? Optional.empty() : Optional.of(items.get(0).name());
    }

    @Override
    public void close() {
        cache().close();
    }

    static int effectiveNeighborCount(int neighborCount) {
        return neighborCount > 0 ? neighborCount : DEFAULT_NEIGHBOR_COUNT;
    }

    private static NodeFactory nodeFactory(SpotifyClient client) {
        Objects.requireNonNull(client, "client must not be null");
        return (graph, index, name, externalId) -> {
            String artistId = externalId;
            if (artistId == null) {
                artistId = client.searchArtistsByName(name).stream()
                        .filter(item -> item.name().equals(name))
                        .map(NeighborRef::externalId)
                        .findFirst()
                        .orElseThrow(() -> new SpotifyClientException(
                                "Spotify artist nodes must always have an external ID: " + name));
                logger.debug("Looked up Spotify ID {} for {}", artistId, name);
            }
            return new Node(graph, index, name, artistId);
        };
    }

    private static NeighborSource neighborSource(SpotifyClient client, int limit) {
        return node -> {
            String artistId = node.externalId()
                    .orElseThrow(() -> new SpotifyClientException("Artist has no Spotify ID: " + node.name()));
            List<NeighborRef> related = client.relatedArtists(artistId);
            return related.size() > limit ? related.subList(0, limit) : related;
        };
    }
}
