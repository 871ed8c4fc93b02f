package com.libris.catalog.domain;

import java.time.Instant;

/**
 * A catalog record.
 *
 * @param version incremented on every update, used for optimistic conflict detection
 */
public record Book(
        long id,
        String title,
        String author,
        int publishedYear,
        int version,
        Instant createdAt,
        Instant updatedAt) {

    /** Copy with new descriptive fields, keeping identity, version and timestamps. */
    public Book withDetails(String newTitle, String newAuthor, int newPublishedYear) {
        return new Book(id, newTitle, newAuthor, newPublishedYear, version, createdAt, updatedAt);
    }
}
