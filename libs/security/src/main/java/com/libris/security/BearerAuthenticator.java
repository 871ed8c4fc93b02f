package com.libris.security;

import com.libris.common.error.AuthenticationException;
import com.libris.common.error.AuthenticationException.Reason;
import com.libris.common.error.RecordNotFoundException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves an inbound Authorization header to the authenticated subject.
 *
 * <p>Every protected operation passes through {@link #authenticate(String)} before any
 * per-action check. Only {@link TokenScope#AUTHENTICATION} tokens are accepted.
 *
 * @param <S> the subject type
 */
public class BearerAuthenticator<S> {

    private static final Logger log = LoggerFactory.getLogger(BearerAuthenticator.class);

    private final TokenStore<S> tokenStore;
    private final TokenCodec tokenCodec;

    public BearerAuthenticator(TokenStore<S> tokenStore, TokenCodec tokenCodec) {
        this.tokenStore = Objects.requireNonNull(tokenStore, "tokenStore");
        this.tokenCodec = Objects.requireNonNull(tokenCodec, "tokenCodec");
    }

    /**
     * @param authorizationHeader raw header value, may be null
     * @return the subject owning the presented token
     * @throws AuthenticationException with {@link Reason#MISSING_CREDENTIAL} when no bearer token is
     *     present, {@link Reason#INVALID_CREDENTIAL} when it is malformed or does not resolve
     */
    public S authenticate(String authorizationHeader) {
        String plaintext =
                BearerTokenExtractor.extract(authorizationHeader)
                        .orElseThrow(() -> new AuthenticationException(Reason.MISSING_CREDENTIAL));

        if (!tokenCodec.isWellFormed(plaintext)) {
            log.debug("Rejected malformed bearer token");
            throw new AuthenticationException(Reason.INVALID_CREDENTIAL);
        }

        try {
            return tokenStore.resolve(TokenScope.AUTHENTICATION, plaintext);
        } catch (RecordNotFoundException e) {
            log.debug("Bearer token did not resolve");
            throw new AuthenticationException(Reason.INVALID_CREDENTIAL, e);
        }
    }
}
