/**
 * Safe dynamic listing queries.
 *
 * <p>Client input enters as {@link com.libris.database.query.Filters}; sort values are checked
 * against a {@link com.libris.database.query.SortSafelist} and page parameters against the
 * {@link com.libris.database.query.PaginationPlanner}. The resulting
 * {@link com.libris.database.query.QueryPlan} feeds the
 * {@link com.libris.database.query.SearchQueryBuilder}, which only interpolates developer-declared
 * identifiers and binds every client value.
 */
package com.libris.database.query;
