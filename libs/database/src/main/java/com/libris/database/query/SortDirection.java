package com.libris.database.query;

/** Ordering direction; {@link #sql()} is the only text ever placed in an ORDER BY. */
public enum SortDirection {
    ASC("ASC"),
    DESC("DESC");

    private final String sql;

    SortDirection(String sql) {
        this.sql = sql;
    }

    public String sql() {
        return sql;
    }
}
