package com.libris.security;

import com.libris.common.error.EditConflictException;
import com.libris.common.error.RecordNotFoundException;

/**
 * Persistence contract for hashed tokens.
 *
 * <p>Each operation is independently atomic. Rows are keyed by hash, so concurrent issuance and
 * resolution of different tokens never conflict.
 *
 * @param <S> the subject type a token resolves to
 */
public interface TokenStore<S> {

    /**
     * Stores the token.
     *
     * @throws EditConflictException if a token with the same hash already exists
     */
    void insert(Token token);

    /**
     * Hashes {@code plaintext} and returns the subject owning a token with that hash, the given
     * scope and an expiry in the future.
     *
     * @throws RecordNotFoundException when nothing matches. Unknown hash, wrong scope and expiry
     *     all produce the same exception and message.
     */
    S resolve(TokenScope scope, String plaintext);

    /**
     * Removes every token of {@code subjectId} with {@code scope}. Removing nothing is not an error.
     */
    void deleteAllForSubject(long subjectId, TokenScope scope);
}
