package com.libris.security;

import java.util.Arrays;

/**
 * Purpose tag partitioning the token namespace.
 *
 * <p>Resolution always filters by scope, so an activation token can never authenticate a session
 * and a session token can never activate an account.
 */
public enum TokenScope {
    ACTIVATION("activation"),
    AUTHENTICATION("authentication");

    private final String dbValue;

    TokenScope(String dbValue) {
        this.dbValue = dbValue;
    }

    /** Value stored in the {@code tokens.scope} column. */
    public String dbValue() {
        return dbValue;
    }

    /**
     * @throws IllegalArgumentException for a value no scope maps to
     */
    public static TokenScope fromDbValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.dbValue.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown token scope: " + value));
    }
}
