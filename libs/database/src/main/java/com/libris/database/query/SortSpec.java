package com.libris.database.query;

/**
 * A validated ordering. Instances only come out of {@link SortSafelist#validate(String)}, so
 * {@code column} is always a developer-declared identifier.
 *
 * @param column    SQL column to order by
 * @param direction ascending or descending
 */
public record SortSpec(String column, SortDirection direction) {}
