package com.libris.database.query;

import com.libris.common.validation.FieldValidator;

/**
 * Turns page/page-size parameters into bounded LIMIT/OFFSET values and computes page metadata.
 *
 * <p>Field names in validation errors match the listing query parameters ({@code page},
 * {@code page_size}).
 */
public final class PaginationPlanner {

    public static final int DEFAULT_MAX_PAGE_SIZE = 100;
    public static final int MAX_PAGE = 10_000_000;

    private final int maxPageSize;

    public PaginationPlanner() {
        this(DEFAULT_MAX_PAGE_SIZE);
    }

    /**
     * @param maxPageSize ceiling for {@code page_size}, at least 1
     */
    public PaginationPlanner(int maxPageSize) {
        if (maxPageSize < 1) {
            throw new IllegalArgumentException("maxPageSize must be >= 1");
        }
        this.maxPageSize = maxPageSize;
    }

    public int maxPageSize() {
        return maxPageSize;
    }

    /**
     * Records page and page-size violations on {@code v} without throwing.
     */
    public void check(int page, int pageSize, FieldValidator v) {
        v.check(page > 0, "page", "must be greater than zero");
        v.check(page <= MAX_PAGE, "page", "must be a maximum of 10 million");
        v.check(pageSize > 0, "page_size", "must be greater than zero");
        v.check(pageSize <= maxPageSize, "page_size", "must be a maximum of " + maxPageSize);
    }

    /**
     * @return {@code limit = pageSize}, {@code offset = (page - 1) * pageSize}
     * @throws com.libris.common.error.ValidationException if page or page size is out of range
     */
    public PageBounds plan(int page, int pageSize) {
        var v = new FieldValidator();
        check(page, pageSize, v);
        v.throwIfInvalid();
        return new PageBounds(pageSize, (long) (page - 1) * pageSize);
    }

    /**
     * Pure metadata computation. Zero records yields {@link PageMetadata#empty()}.
     *
     * @throws IllegalArgumentException if {@code pageSize} is less than 1
     */
    public static PageMetadata calculateMetadata(long totalRecords, int page, int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be at least 1, was " + pageSize);
        }
        if (totalRecords == 0) {
            return PageMetadata.empty();
        }
        long lastPage = (totalRecords + pageSize - 1) / pageSize;
        return new PageMetadata(page, pageSize, 1, lastPage, totalRecords);
    }
}
