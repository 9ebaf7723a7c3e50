package com.raditha.lazygraph.spotify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.lazygraph.NeighborRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Minimal Spotify web API client for artist search and related artists.
 * Artists are returned as name and Spotify ID pairs.
 */
public class SpotifyClient {

    private static final Logger logger = LoggerFactory.getLogger(SpotifyClient.class);

    public static final String API_URL = "https://api.spotify.com/v1/";
    public static final int DEFAULT_SEARCH_LIMIT = 5;

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient httpClient;
    private final SpotifyTokenProvider tokenProvider;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public SpotifyClient(String clientId, String clientKey) {
        this(clientId, clientKey, HttpClient.newBuilder().connectTimeout(TIMEOUT).build());
    }

    public SpotifyClient(String clientId, String clientKey, HttpClient httpClient) {
        this(httpClient, new SpotifyTokenProvider(clientId, clientKey, httpClient));
    }

    SpotifyClient(HttpClient httpClient, SpotifyTokenProvider tokenProvider) {
        this.httpClient = httpClient;
        this.tokenProvider = tokenProvider;
    }

    public List<NeighborRef> searchArtistsByName(String artistName) {
        return searchArtistsByName(artistName, DEFAULT_SEARCH_LIMIT);
    }

    /**
     * Search artists matching the given name, best match first.
     *
     * @throws SpotifyClientException if the request fails or returns an artist without name or ID
     */
    public List<NeighborRef> searchArtistsByName(String artistName, int limit) {
        String query = "search?q=" + URLEncoder.encode(artistName, StandardCharsets.UTF_8)
                + "&type=artist&limit=" + limit;
        JsonNode body = get(query);
        return body == null ? List.of() : toArtists(body.path("artists").path("items"));
    }

    /**
     * Artists Spotify considers related to the artist with the given ID.
     *
     * @throws SpotifyClientException if the request fails or returns an artist without name or ID
     */
    public List<NeighborRef> relatedArtists(String artistId) {
        JsonNode body = get("artists/" + URLEncoder.encode(artistId, StandardCharsets.UTF_8)
                + "/related-artists");
        return body == null ? List.of() : toArtists(body.path("artists"));
    }

    /**
     * @return the parsed response body, or null if the body is empty
     */
    private JsonNode get(String path) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(API_URL + path))
                .header("Authorization", "Bearer " + tokenProvider.accessToken())
                .timeout(TIMEOUT)
                .GET()
                .build();
        logger.debug("GET {}", request.uri());

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SpotifyClientException("Spotify request failed: " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SpotifyClientException("Spotify request interrupted: " + path, e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new SpotifyClientException("Spotify request failed with status: "
                    + response.statusCode() + ", body: " + response.body());
        }

        String body = response.body();
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new SpotifyClientException("Invalid Spotify response for " + path, e);
        }
    }

    private static List<NeighborRef> toArtists(JsonNode items) {
        List<NeighborRef> artists = new ArrayList<>();
        for (JsonNode item : items) {
            JsonNode name = item.path("name");
            JsonNode id = item.path("id");
            if (!name.isTextual() || !id.isTextual()) {
                throw new SpotifyClientException("Name or ID is missing");
            }
            artists.add(new NeighborRef(name.asText(), id.asText()));
        }
        return artists;
    }
}
