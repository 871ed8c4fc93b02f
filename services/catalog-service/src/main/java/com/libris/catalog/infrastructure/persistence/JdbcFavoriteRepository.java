package com.libris.catalog.infrastructure.persistence;

import com.libris.catalog.domain.Book;
import com.libris.catalog.domain.FavoriteRepository;
import com.libris.common.error.RecordNotFoundException;
import com.libris.database.jdbc.DataAccessGuard;
import java.util.List;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcFavoriteRepository implements FavoriteRepository {

    private static final String FIND_SQL =
            "SELECT b.id, b.title, b.author, b.published_year, b.version, b.created_at, b.updated_at"
                    + " FROM books b INNER JOIN users_books ub ON ub.book_id = b.id"
                    + " WHERE ub.user_id = ? ORDER BY ub.created_at, b.id";

    private final JdbcTemplate jdbc;

    public JdbcFavoriteRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void add(long userId, long bookId) {
        DataAccessGuard.run(
                "add favourite",
                () -> {
                    try {
                        jdbc.update(
                                "INSERT INTO users_books (user_id, book_id) VALUES (?, ?) ON CONFLICT DO NOTHING",
                                userId,
                                bookId);
                    } catch (DataIntegrityViolationException e) {
                        // foreign key: the book was deleted after it was read
                        throw new RecordNotFoundException("book " + bookId + " not found");
                    }
                });
    }

    @Override
    public List<Book> findBooks(long userId) {
        return DataAccessGuard.call("list favourites", () -> jdbc.query(FIND_SQL, RowMappers.BOOK, userId));
    }
}
