package com.libris.database.query;

/**
 * Pagination metadata returned alongside every listing. Derived per request, never stored.
 *
 * <p>{@link #empty()} (all zeros) means there are no pages at all.
 *
 * @param currentPage  the page that was requested
 * @param pageSize     records per page
 * @param firstPage    always 1 when there are records
 * @param lastPage     {@code ceil(totalRecords / pageSize)}
 * @param totalRecords number of records matching the filters
 */
public record PageMetadata(int currentPage, int pageSize, int firstPage, long lastPage, long totalRecords) {

    private static final PageMetadata EMPTY = new PageMetadata(0, 0, 0, 0, 0);

    public static PageMetadata empty() {
        return EMPTY;
    }
}
