package com.libris.catalog.domain.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.libris.catalog.TestUsers;
import com.libris.catalog.config.TokenProperties;
import com.libris.catalog.domain.User;
import com.libris.catalog.domain.UserRepository;
import com.libris.common.error.AuthenticationException;
import com.libris.common.error.AuthenticationException.Reason;
import com.libris.common.error.ValidationException;
import com.libris.observability.MetricFactory;
import com.libris.security.IssuedToken;
import com.libris.security.TokenCodec;
import com.libris.security.TokenScope;
import com.libris.security.testing.InMemoryTokenStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

@ExtendWith(MockitoExtension.class)
@DisplayName("TokenService")
class TokenServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock private UserRepository users;

    // low cost keeps the test fast
    private final BCryptPasswordEncoder encoder = spy(new BCryptPasswordEncoder(4));
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final TokenCodec codec = new TokenCodec(new SecureRandom(), clock);
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private User reader;
    private InMemoryTokenStore<User> tokens;
    private TokenService service;

    @BeforeEach
    void setUp() {
        User base = TestUsers.user(21);
        reader = new User(base.id(), base.name(), base.email(), encoder.encode("correct horse"),
                true, base.version(), base.createdAt());
        tokens = new InMemoryTokenStore<>(codec, clock, id -> id == reader.id() ? reader : null);
        service = new TokenService(users, tokens, codec, encoder, new TokenProperties(null, null),
                new MetricFactory(registry, "catalog-test"));
    }

    @Test
    @DisplayName("issues an AUTHENTICATION token valid for 24 hours")
    void issuesToken() {
        when(users.findByEmail(reader.email())).thenReturn(Optional.of(reader));

        IssuedToken issued = service.createAuthenticationToken(reader.email(), "correct horse");

        assertThat(issued.expiry()).isEqualTo(NOW.plus(Duration.ofHours(24)));
        assertThat(tokens.resolve(TokenScope.AUTHENTICATION, issued.plaintext())).isEqualTo(reader);
        assertThat(registry.get(TokenService.TOKENS_ISSUED_METRIC).counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("a wrong password and an unknown email fail identically")
    void wrongPasswordAndUnknownEmail() {
        when(users.findByEmail(reader.email())).thenReturn(Optional.of(reader));
        when(users.findByEmail("nobody@example.com")).thenReturn(Optional.empty());

        Throwable wrongPassword =
                catchThrowable(
                        () -> service.createAuthenticationToken(reader.email(), "wrong password"));
        Throwable unknownEmail =
                catchThrowable(
                        () -> service.createAuthenticationToken("nobody@example.com", "correct horse"));

        assertThat(wrongPassword).isInstanceOf(AuthenticationException.class);
        assertThat(unknownEmail).isInstanceOf(AuthenticationException.class);
        assertThat(((AuthenticationException) wrongPassword).reason()).isEqualTo(Reason.INVALID_LOGIN);
        assertThat(wrongPassword.getMessage()).isEqualTo(unknownEmail.getMessage());
        assertThat(tokens.size()).isZero();
        assertThat(registry.get(TokenService.AUTH_FAILURES_METRIC).counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("malformed credentials are a validation error")
    void malformedCredentials() {
        assertThatThrownBy(() -> service.createAuthenticationToken("nope", ""))
                .isInstanceOf(ValidationException.class)
                .satisfies(ex -> assertThat(((ValidationException) ex).fieldErrors())
                        .containsOnlyKeys("email", "password"));
    }

    @Test
    @DisplayName("an unknown email still runs a password hash comparison")
    void unknownEmailStillComparesHash() {
        when(users.findByEmail("nobody@example.com")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.createAuthenticationToken("nobody@example.com", "correct horse"))
                .isInstanceOf(AuthenticationException.class);

        verify(encoder).matches(eq("correct horse"), anyString());
    }
}
