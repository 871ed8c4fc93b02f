package com.libris.catalog.domain;

import com.libris.common.error.EditConflictException;
import com.libris.database.query.Page;
import com.libris.database.query.QueryPlan;
import java.util.Optional;

/** Persistence port for {@link Book}. */
public interface BookRepository {

    /**
     * Full-text filtered, sorted page of books. Empty {@code title}/{@code author} match everything.
     */
    Page<Book> search(String title, String author, QueryPlan plan);

    Optional<Book> findById(long id);

    /** Inserts and returns the stored book with its generated id, version and timestamps. */
    Book insert(String title, String author, int publishedYear);

    /**
     * Writes the book's details if its stored version still equals {@code book.version()}.
     *
     * @return the stored book with the incremented version
     * @throws EditConflictException if the row changed or disappeared since it was read
     */
    Book update(Book book);

    /** @return false when no such book exists */
    boolean delete(long id);
}
