package com.raditha.lazygraph.cache;

/**
 * Raised when the persistent cache cannot be read or written.
 */
public class GraphCacheException extends RuntimeException {

    public GraphCacheException(String message) {
        super(message);
    }

    public GraphCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
