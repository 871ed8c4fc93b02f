package com.libris.common.error;

/**
 * Base type of every failure raised by Libris code.
 *
 * <p>Unchecked, like the rest of the platform's exceptions: callers that can react to a specific
 * kind catch it, everyone else lets it travel to the boundary.
 */
public abstract class CatalogException extends RuntimeException {

    private final ErrorKind kind;

    protected CatalogException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected CatalogException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /** The failure kind the boundary maps to a response. */
    public ErrorKind kind() {
        return kind;
    }
}
