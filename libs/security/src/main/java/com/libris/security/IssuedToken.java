package com.libris.security;

import java.time.Instant;

/**
 * Result of {@link TokenCodec#issue}: the plaintext handed to the client exactly once, plus the
 * {@link Token} to persist.
 *
 * <p>{@link #toString()} never prints the plaintext.
 *
 * @param plaintext base32 secret for the client (26 characters, no padding)
 * @param token     the hashed credential to store
 */
public record IssuedToken(String plaintext, Token token) {

    public Instant expiry() {
        return token.expiry();
    }

    @Override
    public String toString() {
        return "IssuedToken[plaintext=***, token=" + token + "]";
    }
}
