package com.raditha.lazygraph;

/**
 * Raised when a {@link NeighborSource} fails to deliver the neighbors of a node.
 */
public class NeighborSourceException extends RuntimeException {

    public NeighborSourceException(String message) {
        super(message);
    }

    public NeighborSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
