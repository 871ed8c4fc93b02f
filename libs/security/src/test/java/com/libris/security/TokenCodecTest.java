package com.libris.security;

import com.libris.common.error.ValidationException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TokenCodec")
class TokenCodecTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final TokenCodec codec = new TokenCodec(new SecureRandom(), Clock.fixed(NOW, ZoneOffset.UTC));

    @Nested
    @DisplayName("issue")
    class Issue {

        @Test
        @DisplayName("plaintext is 26 base32 characters without padding")
        void plaintextShape() {
            IssuedToken issued = codec.issue(7L, Duration.ofHours(24), TokenScope.AUTHENTICATION);

            assertThat(issued.plaintext()).hasSize(TokenCodec.PLAINTEXT_LENGTH).matches("[A-Z2-7]{26}");
        }

        @Test
        @DisplayName("token carries SHA-256 of the plaintext, subject, scope and expiry")
        void tokenFields() throws Exception {
            IssuedToken issued = codec.issue(7L, Duration.ofDays(3), TokenScope.ACTIVATION);

            byte[] expected = MessageDigest.getInstance("SHA-256")
                    .digest(issued.plaintext().getBytes(StandardCharsets.UTF_8));
            Token token = issued.token();
            assertThat(token.hash()).isEqualTo(expected);
            assertThat(token.subjectId()).isEqualTo(7L);
            assertThat(token.scope()).isEqualTo(TokenScope.ACTIVATION);
            assertThat(token.expiry()).isEqualTo(NOW.plus(Duration.ofDays(3)));
            assertThat(issued.expiry()).isEqualTo(token.expiry());
        }

        @Test
        @DisplayName("successive issues produce distinct secrets")
        void distinctSecrets() {
            Set<String> seen = new HashSet<>();
            for (int i = 0; i < 200; i++) {
                seen.add(codec.issue(1L, Duration.ofMinutes(1), TokenScope.AUTHENTICATION).plaintext());
            }
            assertThat(seen).hasSize(200);
        }

        @Test
        @DisplayName("toString never exposes the plaintext")
        void toStringHidesPlaintext() {
            IssuedToken issued = codec.issue(1L, Duration.ofMinutes(1), TokenScope.AUTHENTICATION);

            assertThat(issued.toString()).doesNotContain(issued.plaintext());
        }

        @Test
        @DisplayName("rejects non-positive ttl")
        void rejectsNonPositiveTtl() {
            assertThatThrownBy(() -> codec.issue(1L, Duration.ZERO, TokenScope.AUTHENTICATION))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> codec.issue(1L, Duration.ofSeconds(-1), TokenScope.AUTHENTICATION))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("wraps an unavailable entropy source in TokenGenerationException")
        void entropyFailure() {
            SecureRandom broken = new SecureRandom() {
                @Override
                public void nextBytes(byte[] bytes) {
                    throw new IllegalStateException("no entropy");
                }
            };
            var failing = new TokenCodec(broken, Clock.systemUTC());

            assertThatThrownBy(() -> failing.issue(1L, Duration.ofMinutes(1), TokenScope.ACTIVATION))
                    .isInstanceOf(TokenGenerationException.class)
                    .hasCauseInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    @DisplayName("hash is deterministic and differs for a one-character change")
    void hashDeterministic() {
        assertThat(codec.hash("ABCDEFGHIJKLMNOPQRSTUVWXYZ")).isEqualTo(codec.hash("ABCDEFGHIJKLMNOPQRSTUVWXYZ"));
        assertThat(codec.hash("ABCDEFGHIJKLMNOPQRSTUVWXYZ")).isNotEqualTo(codec.hash("ABCDEFGHIJKLMNOPQRSTUVWXY2"));
    }

    @Nested
    @DisplayName("validatePlaintext")
    class ValidatePlaintext {

        @Test
        @DisplayName("accepts a 26-character token")
        void acceptsWellFormed() {
            codec.validatePlaintext("ABCDEFGHIJKLMNOPQRSTUVWXYZ");
            assertThat(codec.isWellFormed("ABCDEFGHIJKLMNOPQRSTUVWXYZ")).isTrue();
        }

        @Test
        @DisplayName("rejects empty token with 'must be provided'")
        void rejectsEmpty() {
            assertThatThrownBy(() -> codec.validatePlaintext(""))
                    .isInstanceOf(ValidationException.class)
                    .satisfies(e -> assertThat(((ValidationException) e).fieldErrors())
                            .containsEntry("token", "must be provided"));
        }

        @Test
        @DisplayName("rejects wrong length with 'must be 26 bytes long'")
        void rejectsWrongLength() {
            assertThatThrownBy(() -> codec.validatePlaintext("SHORT"))
                    .isInstanceOf(ValidationException.class)
                    .satisfies(e -> assertThat(((ValidationException) e).fieldErrors())
                            .containsEntry("token", "must be 26 bytes long"));
            assertThat(codec.isWellFormed("SHORT")).isFalse();
            assertThat(codec.isWellFormed(null)).isFalse();
        }
    }
}
