package com.libris.security;

import com.libris.common.error.ValidationException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.apache.commons.codec.binary.Base32;

/**
 * Generates opaque bearer secrets and derives their lookup hash.
 *
 * <p>A secret is {@value #SECRET_BYTES} bytes from {@link SecureRandom}, base32-encoded without
 * padding, which yields {@value #PLAINTEXT_LENGTH} characters. Only {@code SHA-256(plaintext)} is
 * meant to be stored.
 *
 * <p>Thread-safe.
 */
public class TokenCodec {

    public static final int SECRET_BYTES = 16;
    public static final int PLAINTEXT_LENGTH = 26;

    private static final String DIGEST_ALGORITHM = "SHA-256";

    private final SecureRandom random;
    private final Clock clock;
    private final Base32 base32 = new Base32();

    public TokenCodec() {
        this(new SecureRandom(), Clock.systemUTC());
    }

    public TokenCodec(SecureRandom random, Clock clock) {
        this.random = Objects.requireNonNull(random, "random");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Issues a fresh credential for {@code subjectId}. Nothing is persisted here.
     *
     * @param subjectId owning user
     * @param ttl       lifetime, must be positive
     * @param scope     purpose of the token
     * @return the plaintext for the client together with the hashed {@link Token}
     * @throws TokenGenerationException if the entropy or digest source is unavailable
     */
    public IssuedToken issue(long subjectId, Duration ttl, TokenScope scope) {
        Objects.requireNonNull(scope, "scope");
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }

        byte[] secret = new byte[SECRET_BYTES];
        try {
            random.nextBytes(secret);
        } catch (RuntimeException e) {
            throw new TokenGenerationException("secure random source unavailable", e);
        }

        String plaintext = stripPadding(base32.encodeToString(secret));
        Instant expiry = clock.instant().plus(ttl);
        return new IssuedToken(plaintext, new Token(hash(plaintext), subjectId, scope, expiry));
    }

    /**
     * Deterministic lookup hash of a plaintext secret.
     */
    public byte[] hash(String plaintext) {
        Objects.requireNonNull(plaintext, "plaintext");
        try {
            return MessageDigest.getInstance(DIGEST_ALGORITHM)
                    .digest(plaintext.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new TokenGenerationException(DIGEST_ALGORITHM + " not available", e);
        }
    }

    /**
     * Checks the shape of a client-supplied plaintext.
     *
     * @throws ValidationException on field {@code token}
     */
    public void validatePlaintext(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            throw new ValidationException("token", "must be provided");
        }
        if (plaintext.length() != PLAINTEXT_LENGTH) {
            throw new ValidationException("token", "must be " + PLAINTEXT_LENGTH + " bytes long");
        }
    }

    /** Non-throwing variant of {@link #validatePlaintext(String)}. */
    public boolean isWellFormed(String plaintext) {
        return plaintext != null && plaintext.length() == PLAINTEXT_LENGTH;
    }

    private static String stripPadding(String encoded) {
        int end = encoded.length();
        while (end > 0 && encoded.charAt(end - 1) == '=') {
            end--;
        }
        return encoded.substring(0, end);
    }
}
