package com.libris.catalog.infrastructure.persistence;

import com.libris.catalog.domain.User;
import com.libris.common.error.EditConflictException;
import com.libris.common.error.RecordNotFoundException;
import com.libris.database.jdbc.DataAccessGuard;
import com.libris.security.Token;
import com.libris.security.TokenCodec;
import com.libris.security.TokenScope;
import com.libris.security.TokenStore;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * {@link TokenStore} over the {@code tokens} table. Rows hold only the SHA-256 hash of a secret.
 *
 * <p>Expiry is compared against the database clock.
 */
@Repository
public class JdbcTokenStore implements TokenStore<User> {

    static final String NOT_FOUND = "token not found";

    private static final String RESOLVE_SQL =
            "SELECT u.id, u.name, u.email, u.password_hash, u.activated, u.version, u.created_at"
                    + " FROM users u INNER JOIN tokens t ON t.user_id = u.id"
                    + " WHERE t.hash = ? AND t.scope = ? AND t.expiry > NOW()";

    private final JdbcTemplate jdbc;
    private final TokenCodec codec;

    public JdbcTokenStore(JdbcTemplate jdbc, TokenCodec codec) {
        this.jdbc = jdbc;
        this.codec = codec;
    }

    @Override
    public void insert(Token token) {
        DataAccessGuard.run(
                "insert token",
                () -> {
                    try {
                        jdbc.update(
                                "INSERT INTO tokens (hash, user_id, expiry, scope) VALUES (?, ?, ?, ?)",
                                token.hash(),
                                token.subjectId(),
                                OffsetDateTime.ofInstant(token.expiry(), ZoneOffset.UTC),
                                token.scope().dbValue());
                    } catch (DuplicateKeyException e) {
                        throw new EditConflictException("token hash collision", e);
                    }
                });
    }

    @Override
    public User resolve(TokenScope scope, String plaintext) {
        byte[] hash = codec.hash(plaintext);
        return DataAccessGuard.call(
                "resolve token",
                () ->
                        jdbc.query(RESOLVE_SQL, RowMappers.USER, hash, scope.dbValue()).stream()
                                .findFirst()
                                .orElseThrow(() -> new RecordNotFoundException(NOT_FOUND)));
    }

    @Override
    public void deleteAllForSubject(long subjectId, TokenScope scope) {
        DataAccessGuard.run(
                "delete tokens",
                () ->
                        jdbc.update(
                                "DELETE FROM tokens WHERE user_id = ? AND scope = ?",
                                subjectId,
                                scope.dbValue()));
    }
}
