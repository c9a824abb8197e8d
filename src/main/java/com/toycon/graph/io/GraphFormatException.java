package com.toycon.graph.io;

/**
 * Persisted graph text that cannot be loaded at all (missing or unknown
 * header). Individual malformed lines never raise this; they are skipped.
 */
public class GraphFormatException extends RuntimeException {
    public GraphFormatException(String message) {
        super(message);
    }

    public GraphFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
