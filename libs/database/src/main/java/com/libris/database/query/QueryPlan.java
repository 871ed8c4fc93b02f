package com.libris.database.query;

/**
 * Validated ordering and bounds for one listing request.
 *
 * @param sort     ordering taken from the safelist
 * @param bounds   LIMIT/OFFSET
 * @param page     requested page, kept for metadata
 * @param pageSize requested page size, kept for metadata
 */
public record QueryPlan(SortSpec sort, PageBounds bounds, int page, int pageSize) {}
