package com.libris.security;

import java.time.Instant;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * The persisted half of a credential. Holds the SHA-256 lookup hash, never the plaintext.
 *
 * @param hash      SHA-256 digest of the plaintext (32 bytes)
 * @param subjectId id of the owning user
 * @param scope     what the token may be used for
 * @param expiry    instant after which the token no longer resolves
 */
public record Token(byte[] hash, long subjectId, TokenScope scope, Instant expiry) {

    public Token {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(expiry, "expiry");
        hash = hash.clone();
    }

    @Override
    public byte[] hash() {
        return hash.clone();
    }

    public boolean isExpiredAt(Instant now) {
        return !expiry.isAfter(now);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Token other
                && subjectId == other.subjectId
                && scope == other.scope
                && expiry.equals(other.expiry)
                && Arrays.equals(hash, other.hash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(hash), subjectId, scope, expiry);
    }

    @Override
    public String toString() {
        return "Token[hash=" + HexFormat.of().formatHex(hash, 0, 4) + "…, subjectId=" + subjectId
                + ", scope=" + scope + ", expiry=" + expiry + "]";
    }
}
