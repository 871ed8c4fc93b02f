package com.libris.catalog.domain.service;

import com.libris.catalog.config.TokenProperties;
import com.libris.catalog.domain.User;
import com.libris.catalog.domain.UserRepository;
import com.libris.common.error.AuthenticationException;
import com.libris.common.error.AuthenticationException.Reason;
import com.libris.common.validation.FieldValidator;
import com.libris.observability.MetricFactory;
import com.libris.security.IssuedToken;
import com.libris.security.TokenCodec;
import com.libris.security.TokenScope;
import com.libris.security.TokenStore;
import io.micrometer.core.instrument.Counter;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/** Issues login (AUTHENTICATION scope) tokens. */
@Service
public class TokenService {

    private static final Logger log = LoggerFactory.getLogger(TokenService.class);

    public static final String TOKENS_ISSUED_METRIC = "libris.tokens.issued";
    public static final String AUTH_FAILURES_METRIC = "libris.auth.failures";

    private final UserRepository users;
    private final TokenStore<User> tokens;
    private final TokenCodec codec;
    private final PasswordEncoder passwordEncoder;
    private final TokenProperties tokenProperties;
    private final Counter issued;
    private final Counter loginFailures;
    // checked against when the email is unknown
    private final String unknownUserHash;

    public TokenService(
            UserRepository users,
            TokenStore<User> tokens,
            TokenCodec codec,
            PasswordEncoder passwordEncoder,
            TokenProperties tokenProperties,
            MetricFactory metrics) {
        this.users = users;
        this.tokens = tokens;
        this.codec = codec;
        this.passwordEncoder = passwordEncoder;
        this.tokenProperties = tokenProperties;
        this.issued = metrics.counter(TOKENS_ISSUED_METRIC, "Bearer tokens issued", "scope", "authentication");
        this.loginFailures =
                metrics.counter(AUTH_FAILURES_METRIC, "Rejected credentials", "reason", "invalid_login");
        this.unknownUserHash = passwordEncoder.encode(UUID.randomUUID().toString());
    }

    /**
     * Exchanges an email and password for a fresh AUTHENTICATION token.
     *
     * @throws com.libris.common.error.ValidationException if email or password is malformed
     * @throws AuthenticationException with {@link Reason#INVALID_LOGIN} for an unknown email or wrong
     *     password; the two cases are not distinguishable by the caller
     */
    public IssuedToken createAuthenticationToken(String email, String password) {
        var v = new FieldValidator();
        UserService.checkEmail(v, email);
        UserService.checkPassword(v, password);
        v.throwIfInvalid();

        Optional<User> candidate = users.findByEmail(email);
        boolean passwordMatches =
                passwordEncoder.matches(password, candidate.map(User::passwordHash).orElse(unknownUserHash));
        if (candidate.isEmpty() || !passwordMatches) {
            loginFailures.increment();
            log.debug("Rejected login attempt");
            throw new AuthenticationException(Reason.INVALID_LOGIN);
        }
        User user = candidate.get();

        IssuedToken token =
                codec.issue(user.id(), tokenProperties.authenticationTtl(), TokenScope.AUTHENTICATION);
        tokens.insert(token.token());
        issued.increment();
        log.info("Issued authentication token for user {} expiring {}", user.id(), token.expiry());
        return token;
    }
}
