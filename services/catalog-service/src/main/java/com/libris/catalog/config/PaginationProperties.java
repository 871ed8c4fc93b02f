package com.libris.catalog.config;

import jakarta.validation.constraints.AssertTrue;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Listing defaults, bound from {@code libris.pagination.*}.
 *
 * @param defaultPageSize page size used when the client sends none (default 20)
 * @param maxPageSize     largest page size a client may request (default 100)
 */
@ConfigurationProperties(prefix = "libris.pagination")
@Validated
public record PaginationProperties(int defaultPageSize, int maxPageSize) {

    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int DEFAULT_MAX_PAGE_SIZE = 100;

    public PaginationProperties {
        if (defaultPageSize <= 0) {
            defaultPageSize = DEFAULT_PAGE_SIZE;
        }
        if (maxPageSize <= 0) {
            maxPageSize = DEFAULT_MAX_PAGE_SIZE;
        }
    }

    @AssertTrue(message = "default-page-size must not exceed max-page-size")
    public boolean isDefaultWithinMax() {
        return defaultPageSize <= maxPageSize;
    }
}
