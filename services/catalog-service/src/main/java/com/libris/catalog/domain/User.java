package com.libris.catalog.domain;

import java.time.Instant;

/**
 * An account, and the subject every bearer token resolves to.
 *
 * @param passwordHash BCrypt hash, never the plaintext
 * @param version      incremented on every update
 */
public record User(
        long id,
        String name,
        String email,
        String passwordHash,
        boolean activated,
        int version,
        Instant createdAt) {

    public User activate() {
        return new User(id, name, email, passwordHash, true, version, createdAt);
    }

    @Override
    public String toString() {
        return "User[id=" + id + ", email=" + email + ", activated=" + activated + ", version=" + version + "]";
    }
}
