package com.libris.catalog.domain;

import com.libris.common.error.RecordNotFoundException;
import java.util.List;

/** A user's favourite books. */
public interface FavoriteRepository {

    /**
     * Idempotent: adding an existing favourite is a no-op.
     *
     * @throws RecordNotFoundException if the book or user no longer exists
     */
    void add(long userId, long bookId);

    /** Favourites in the order they were added. */
    List<Book> findBooks(long userId);
}
