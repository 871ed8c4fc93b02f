package com.libris.catalog.infrastructure.persistence;

import static com.libris.catalog.infrastructure.persistence.RowMappers.USER;
import static com.libris.catalog.infrastructure.persistence.RowMappers.USER_SELECT;

import com.libris.catalog.domain.DuplicateEmailException;
import com.libris.catalog.domain.User;
import com.libris.catalog.domain.UserRepository;
import com.libris.common.error.EditConflictException;
import com.libris.database.jdbc.DataAccessGuard;
import java.util.List;
import java.util.Optional;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcUserRepository implements UserRepository {

    private final JdbcTemplate jdbc;

    public JdbcUserRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public User insert(String name, String email, String passwordHash) {
        return DataAccessGuard.call(
                "insert user",
                () -> {
                    try {
                        return jdbc.queryForObject(
                                "INSERT INTO users (name, email, password_hash, activated) VALUES (?, ?, ?, FALSE)"
                                        + " RETURNING " + USER_SELECT,
                                USER,
                                name,
                                email,
                                passwordHash);
                    } catch (DuplicateKeyException e) {
                        throw new DuplicateEmailException();
                    }
                });
    }

    @Override
    public Optional<User> findByEmail(String email) {
        return DataAccessGuard.call(
                "get user by email",
                () ->
                        jdbc.query("SELECT " + USER_SELECT + " FROM users WHERE email = ?::citext", USER, email)
                                .stream()
                                .findFirst());
    }

    @Override
    public User update(User user) {
        List<User> updated =
                DataAccessGuard.call(
                        "update user",
                        () -> {
                            try {
                                return jdbc.query(
                                        "UPDATE users SET name = ?, email = ?, password_hash = ?, activated = ?,"
                                                + " version = version + 1, updated_at = NOW()"
                                                + " WHERE id = ? AND version = ? RETURNING " + USER_SELECT,
                                        USER,
                                        user.name(),
                                        user.email(),
                                        user.passwordHash(),
                                        user.activated(),
                                        user.id(),
                                        user.version());
                            } catch (DuplicateKeyException e) {
                                throw new DuplicateEmailException();
                            }
                        });
        if (updated.isEmpty()) {
            throw new EditConflictException("user " + user.id() + " changed since version " + user.version());
        }
        return updated.get(0);
    }
}
