package com.libris.database.query;

import java.util.regex.Pattern;

/** Guards identifiers that are interpolated into SQL text. */
final class SqlIdentifiers {

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

    private SqlIdentifiers() {
        // utility class
    }

    /**
     * @throws IllegalArgumentException unless {@code name} is a plain lower-case identifier
     */
    static String require(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Not a safe SQL identifier: " + name);
        }
        return name;
    }
}
