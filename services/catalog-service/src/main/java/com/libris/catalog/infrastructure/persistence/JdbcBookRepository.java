package com.libris.catalog.infrastructure.persistence;

import static com.libris.catalog.infrastructure.persistence.RowMappers.BOOK;
import static com.libris.catalog.infrastructure.persistence.RowMappers.BOOK_COLUMNS;
import static com.libris.catalog.infrastructure.persistence.RowMappers.BOOK_SELECT;

import com.libris.catalog.domain.Book;
import com.libris.catalog.domain.BookRepository;
import com.libris.common.error.EditConflictException;
import com.libris.database.jdbc.DataAccessGuard;
import com.libris.database.jdbc.PagedQueryExecutor;
import com.libris.database.query.Page;
import com.libris.database.query.QueryPlan;
import com.libris.database.query.SearchQuery;
import com.libris.database.query.SearchQueryBuilder;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcBookRepository implements BookRepository {

    private final JdbcTemplate jdbc;
    private final PagedQueryExecutor pagedQueries;

    public JdbcBookRepository(JdbcTemplate jdbc, PagedQueryExecutor pagedQueries) {
        this.jdbc = jdbc;
        this.pagedQueries = pagedQueries;
    }

    @Override
    public Page<Book> search(String title, String author, QueryPlan plan) {
        SearchQuery query =
                SearchQueryBuilder.from("books", "id")
                        .columns(BOOK_COLUMNS)
                        .textMatch("title", title)
                        .textMatch("author", author)
                        .build(plan);
        return pagedQueries.fetch(query, BOOK);
    }

    @Override
    public Optional<Book> findById(long id) {
        return DataAccessGuard.call(
                "get book",
                () ->
                        jdbc.query("SELECT " + BOOK_SELECT + " FROM books WHERE id = ?", BOOK, id)
                                .stream()
                                .findFirst());
    }

    @Override
    public Book insert(String title, String author, int publishedYear) {
        return DataAccessGuard.call(
                "insert book",
                () ->
                        jdbc.queryForObject(
                                "INSERT INTO books (title, author, published_year) VALUES (?, ?, ?)"
                                        + " RETURNING " + BOOK_SELECT,
                                BOOK,
                                title,
                                author,
                                publishedYear));
    }

    @Override
    public Book update(Book book) {
        List<Book> updated =
                DataAccessGuard.call(
                        "update book",
                        () ->
                                jdbc.query(
                                        "UPDATE books SET title = ?, author = ?, published_year = ?,"
                                                + " version = version + 1, updated_at = NOW()"
                                                + " WHERE id = ? AND version = ? RETURNING " + BOOK_SELECT,
                                        BOOK,
                                        book.title(),
                                        book.author(),
                                        book.publishedYear(),
                                        book.id(),
                                        book.version()));
        if (updated.isEmpty()) {
            throw new EditConflictException("book " + book.id() + " changed since version " + book.version());
        }
        return updated.get(0);
    }

    @Override
    public boolean delete(long id) {
        return DataAccessGuard.call("delete book", () -> jdbc.update("DELETE FROM books WHERE id = ?", id)) > 0;
    }
}
