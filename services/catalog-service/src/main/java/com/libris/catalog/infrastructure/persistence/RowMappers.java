package com.libris.catalog.infrastructure.persistence;

import com.libris.catalog.domain.Book;
import com.libris.catalog.domain.User;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import org.springframework.jdbc.core.RowMapper;

/** Column lists and row mappers shared by the JDBC adapters. */
final class RowMappers {

    static final String[] BOOK_COLUMNS = {
        "id", "title", "author", "published_year", "version", "created_at", "updated_at"
    };

    static final String BOOK_SELECT = String.join(", ", BOOK_COLUMNS);

    static final String USER_SELECT = "id, name, email, password_hash, activated, version, created_at";

    static final RowMapper<Book> BOOK =
            (rs, rowNum) ->
                    new Book(
                            rs.getLong("id"),
                            rs.getString("title"),
                            rs.getString("author"),
                            rs.getInt("published_year"),
                            rs.getInt("version"),
                            instant(rs, "created_at"),
                            instant(rs, "updated_at"));

    static final RowMapper<User> USER =
            (rs, rowNum) ->
                    new User(
                            rs.getLong("id"),
                            rs.getString("name"),
                            rs.getString("email"),
                            rs.getString("password_hash"),
                            rs.getBoolean("activated"),
                            rs.getInt("version"),
                            instant(rs, "created_at"));

    private RowMappers() {}

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }
}
