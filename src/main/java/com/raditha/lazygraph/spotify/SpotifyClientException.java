package com.raditha.lazygraph.spotify;

import com.raditha.lazygraph.NeighborSourceException;

/**
 * Raised when the Spotify web API cannot be reached or returns unusable data.
 */
public class SpotifyClientException extends NeighborSourceException {

    public SpotifyClientException(String message) {
        super(message);
    }

    public SpotifyClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
