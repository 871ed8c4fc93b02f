package com.libris.common.error;

/**
 * Closed set of failure kinds a Libris operation can report.
 *
 * <p>The outermost boundary (REST advice, CLI, tests) switches on the kind to decide the wire-level
 * status. Core code never writes a response itself.
 */
public enum ErrorKind {

    /** Bad client input: out-of-range page, unknown sort key, malformed field. */
    VALIDATION,

    /** Missing, invalid, expired or wrong-scope credential. */
    AUTHENTICATION,

    /** The addressed record or subject does not exist. */
    NOT_FOUND,

    /** Optimistic version mismatch or unique-key collision; safe to retry after re-reading. */
    CONFLICT,

    /** A store operation exceeded its deadline. */
    TIMEOUT,

    /** Connectivity or other storage failure. */
    STORAGE;

    /**
     * Returns true for kinds caused by the server side rather than by the caller's input.
     */
    public boolean isServerFault() {
        return this == TIMEOUT || this == STORAGE;
    }
}
