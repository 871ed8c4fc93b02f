package com.libris.database.query;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds a ranked, filtered listing statement for PostgreSQL.
 *
 * <p>The statement
 *
 * <ul>
 *   <li>applies one full-text predicate per text field; an empty query matches every row,
 *   <li>orders by the validated {@link SortSpec} and then by the id column ascending, so pages
 *       are deterministic even when sort values repeat,
 *   <li>applies LIMIT/OFFSET from the {@link QueryPlan},
 *   <li>selects {@code count(*) OVER()} as {@value #TOTAL_RECORDS_COLUMN}, so the total comes from
 *       the same execution and snapshot as the page.
 * </ul>
 *
 * <pre>{@code
 * SearchQuery q = SearchQueryBuilder.from("books", "id")
 *         .columns("id", "title", "author", "published_year", "version", "created_at", "updated_at")
 *         .textMatch("title", title)
 *         .textMatch("author", author)
 *         .build(filters.plan(planner));
 * }</pre>
 */
public final class SearchQueryBuilder {

    public static final String TOTAL_RECORDS_COLUMN = "total_records";

    /** Text search configuration: no stemming, no stop words. */
    static final String TEXT_SEARCH_CONFIG = "simple";

    private final String table;
    private final String idColumn;
    private final List<String> columns = new ArrayList<>();
    private final Map<String, String> textMatches = new LinkedHashMap<>();

    private SearchQueryBuilder(String table, String idColumn) {
        this.table = SqlIdentifiers.require(table);
        this.idColumn = SqlIdentifiers.require(idColumn);
    }

    /**
     * @param table    table to list from
     * @param idColumn unique column used as the ordering tiebreak
     */
    public static SearchQueryBuilder from(String table, String idColumn) {
        return new SearchQueryBuilder(table, idColumn);
    }

    /** Columns to select, after the total count. */
    public SearchQueryBuilder columns(String... names) {
        for (String name : names) {
            columns.add(SqlIdentifiers.require(name));
        }
        return this;
    }

    /**
     * Adds a full-text predicate on {@code column}. A null or empty {@code query} matches all rows.
     */
    public SearchQueryBuilder textMatch(String column, String query) {
        textMatches.put(SqlIdentifiers.require(column), query == null ? "" : query);
        return this;
    }

    public SearchQuery build(QueryPlan plan) {
        Objects.requireNonNull(plan, "plan");
        if (columns.isEmpty()) {
            throw new IllegalStateException("no columns selected");
        }

        var sql = new StringBuilder()
                .append("SELECT count(*) OVER() AS ").append(TOTAL_RECORDS_COLUMN).append(", ")
                .append(String.join(", ", columns))
                .append(" FROM ").append(table);
        List<Object> args = new ArrayList<>();

        String glue = " WHERE ";
        for (Map.Entry<String, String> match : textMatches.entrySet()) {
            sql.append(glue)
                    .append("(to_tsvector('").append(TEXT_SEARCH_CONFIG).append("', ").append(match.getKey())
                    .append(") @@ plainto_tsquery('").append(TEXT_SEARCH_CONFIG).append("', ?) OR ? = '')");
            args.add(match.getValue());
            args.add(match.getValue());
            glue = " AND ";
        }

        SortSpec sort = plan.sort();
        sql.append(" ORDER BY ").append(sort.column()).append(' ').append(sort.direction().sql());
        if (!sort.column().equals(idColumn)) {
            sql.append(", ").append(idColumn).append(" ASC");
        }
        sql.append(" LIMIT ? OFFSET ?");
        args.add(plan.bounds().limit());
        args.add(plan.bounds().offset());

        return new SearchQuery(sql.toString(), args, plan);
    }
}
