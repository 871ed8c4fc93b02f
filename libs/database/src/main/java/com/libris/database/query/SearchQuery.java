package com.libris.database.query;

import java.util.List;

/**
 * A fully built listing statement: SQL text with {@code ?} placeholders, the bind arguments in
 * order, and the plan the metadata is derived from.
 *
 * @param sql  statement text; contains only developer-declared identifiers
 * @param args bind arguments, every client value goes here
 * @param plan the validated plan the statement was built from
 */
public record SearchQuery(String sql, List<Object> args, QueryPlan plan) {

    public SearchQuery {
        args = List.copyOf(args);
    }
}
