package com.libris.database.query;

/**
 * LIMIT/OFFSET pair produced by {@link PaginationPlanner#plan(int, int)}. Both non-negative.
 */
public record PageBounds(int limit, long offset) {}
