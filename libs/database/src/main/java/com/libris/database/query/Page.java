package com.libris.database.query;

import java.util.List;

/**
 * One page of records together with the metadata computed from the same statement.
 *
 * @param records   the rows of this page, possibly empty
 * @param metadata  pagination metadata
 * @param <T>       record type
 */
public record Page<T>(List<T> records, PageMetadata metadata) {

    public Page {
        records = List.copyOf(records);
    }

    public static <T> Page<T> empty() {
        return new Page<>(List.of(), PageMetadata.empty());
    }
}
