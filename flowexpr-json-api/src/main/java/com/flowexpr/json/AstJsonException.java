package com.flowexpr.json;

/**
 * A tree could not be written as JSON, or a JSON document does not describe a tree.
 *
 * <p>Structural errors in a document carry the location of the offending node
 * as a path from the root, e.g. {@code $.children[1].children[0]}.</p>
 */
public class AstJsonException extends RuntimeException {
    private final String path;

    public AstJsonException(String message) {
        this(message, null, null);
    }

    public AstJsonException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public AstJsonException(String message, String path, Throwable cause) {
        super(path == null ? message : message + " at " + path, cause);
        this.path = path;
    }

    /**
     * Path of the node the error refers to, or {@code null} when it does not concern a single node.
     */
    public String path() {
        return path;
    }
}
