package com.raditha.lazygraph.spotify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;

/**
 * Access tokens for the Spotify web API obtained with the client credentials flow.
 * <p>
 * A token is reused until it is about to expire.
 */
public class SpotifyTokenProvider {

    private static final Logger logger = LoggerFactory.getLogger(SpotifyTokenProvider.class);

    public static final String TOKEN_URL = "https://accounts.spotify.com/api/token";

    /**
     * Tokens that expire within this period are refreshed before use.
     */
    static final Duration REFRESH_THRESHOLD = Duration.ofSeconds(60);

    private final String clientId;
    private final String clientKey;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock;

    private String accessToken;
    private Instant expiresAt = Instant.EPOCH;

    public SpotifyTokenProvider(String clientId, String clientKey, HttpClient httpClient) {
        this(clientId, clientKey, httpClient, Clock.systemUTC());
    }

    SpotifyTokenProvider(String clientId, String clientKey, HttpClient httpClient, Clock clock) {
        if (clientId == null || clientId.isBlank() || clientKey == null || clientKey.isBlank()) {
            throw new IllegalArgumentException("Spotify client ID and client key are required");
        }
        this.clientId = clientId;
        this.clientKey = clientKey;
        this.httpClient = httpClient;
        this.clock = clock;
    }

    /**
     * Returns a valid access token, requesting a new one if needed.
     *
     * @throws SpotifyClientException if a token cannot be obtained
     */
    public synchronized String accessToken() {
        if (accessToken == null || expiresAt.isBefore(clock.instant().plus(REFRESH_THRESHOLD))) {
            requestToken();
        }
        return accessToken;
    }

    private void requestToken() {
        String credentials = Base64.getEncoder()
                .encodeToString((clientId + ":" + clientKey).getBytes(StandardCharsets.UTF_8));
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(TOKEN_URL))
                .header("Authorization", "Basic " + credentials)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString("grant_type=client_credentials"))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SpotifyClientException("Token request failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SpotifyClientException("Token request interrupted", e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new SpotifyClientException("Token request failed with status: " + response.statusCode());
        }

        try {
            JsonNode token = objectMapper.readTree(response.body());
            JsonNode value = token.path("access_token");
            if (!value.isTextual()) {
                throw new SpotifyClientException("Token response has no access_token");
            }
            JsonNode expiresIn = token.path("expires_in");
            if (!expiresIn.canConvertToLong() || expiresIn.asLong() <= REFRESH_THRESHOLD.getSeconds()) {
                throw new SpotifyClientException("Token response has no usable expires_in: " + expiresIn);
            }
            accessToken = value.asText();
            expiresAt = clock.instant().plusSeconds(expiresIn.asLong());
        } catch (IOException e) {
            throw new SpotifyClientException("Invalid token response", e);
        }
        logger.info("Obtained Spotify access token valid until {}", expiresAt);
    }
}
