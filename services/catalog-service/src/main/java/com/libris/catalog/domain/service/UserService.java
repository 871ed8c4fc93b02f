package com.libris.catalog.domain.service;

import com.libris.catalog.config.TokenProperties;
import com.libris.catalog.domain.User;
import com.libris.catalog.domain.UserRepository;
import com.libris.common.error.RecordNotFoundException;
import com.libris.common.error.ValidationException;
import com.libris.common.validation.FieldValidator;
import com.libris.security.IssuedToken;
import com.libris.security.TokenCodec;
import com.libris.security.TokenScope;
import com.libris.security.TokenStore;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Account registration and activation. */
@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    static final int MAX_NAME_BYTES = 500;
    static final int MIN_PASSWORD_BYTES = 8;
    static final int MAX_PASSWORD_BYTES = 72;

    private final UserRepository users;
    private final TokenStore<User> tokens;
    private final TokenCodec codec;
    private final PasswordEncoder passwordEncoder;
    private final TokenProperties tokenProperties;

    public UserService(
            UserRepository users,
            TokenStore<User> tokens,
            TokenCodec codec,
            PasswordEncoder passwordEncoder,
            TokenProperties tokenProperties) {
        this.users = users;
        this.tokens = tokens;
        this.codec = codec;
        this.passwordEncoder = passwordEncoder;
        this.tokenProperties = tokenProperties;
    }

    /**
     * Creates an inactive account and an activation token for it.
     *
     * @throws ValidationException for bad input, or {@link com.libris.catalog.domain.DuplicateEmailException}
     *     for an email that is already registered
     */
    @Transactional
    public Registration register(String name, String email, String password) {
        var v = new FieldValidator();
        v.check(name != null && !name.isEmpty(), "name", "must be provided");
        v.check(name == null || bytes(name) <= MAX_NAME_BYTES, "name", "must not be more than 500 bytes long");
        checkEmail(v, email);
        checkPassword(v, password);
        v.throwIfInvalid();

        User user = users.insert(name, email, passwordEncoder.encode(password));
        IssuedToken activation = codec.issue(user.id(), tokenProperties.activationTtl(), TokenScope.ACTIVATION);
        tokens.insert(activation.token());

        log.info("Registered user {}", user.id());
        return new Registration(user, activation);
    }

    /**
     * Marks the token's owner as activated and removes all of the owner's activation tokens.
     *
     * @throws ValidationException if the token is malformed, unknown or expired
     * @throws com.libris.common.error.EditConflictException if the account changed concurrently
     */
    @Transactional
    public User activate(String plaintext) {
        codec.validatePlaintext(plaintext);

        User user;
        try {
            user = tokens.resolve(TokenScope.ACTIVATION, plaintext);
        } catch (RecordNotFoundException e) {
            throw new ValidationException("token", "invalid or expired activation token");
        }

        User activated = users.update(user.activate());
        tokens.deleteAllForSubject(activated.id(), TokenScope.ACTIVATION);
        log.info("Activated user {}", activated.id());
        return activated;
    }

    static void checkEmail(FieldValidator v, String email) {
        v.check(email != null && !email.isEmpty(), "email", "must be provided");
        v.check(email == null || email.isEmpty() || FieldValidator.matches(email, FieldValidator.EMAIL),
                "email", "must be a valid email address");
    }

    static void checkPassword(FieldValidator v, String password) {
        v.check(password != null && !password.isEmpty(), "password", "must be provided");
        if (password != null) {
            v.check(bytes(password) >= MIN_PASSWORD_BYTES, "password", "must be at least 8 bytes long");
            v.check(bytes(password) <= MAX_PASSWORD_BYTES, "password", "must not be more than 72 bytes long");
        }
    }

    private static int bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8).length;
    }

    /**
     * A new account and the activation token to deliver to its owner.
     */
    public record Registration(User user, IssuedToken activationToken) {}
}
