package com.libris.common.error;

/**
 * The request could not be tied to an authenticated subject.
 *
 * <p>The {@link Reason} is for logs and metrics only. Responses must render every reason with the
 * same generic text so wrong scope, expiry and unknown hash stay indistinguishable.
 */
public class AuthenticationException extends CatalogException {

    public enum Reason {
        /** No Authorization header, or not a Bearer header. */
        MISSING_CREDENTIAL,
        /** Malformed, unknown, expired or wrong-scope token. */
        INVALID_CREDENTIAL,
        /** Login with an unknown email or a wrong password. */
        INVALID_LOGIN
    }

    private final Reason reason;

    public AuthenticationException(Reason reason) {
        super(ErrorKind.AUTHENTICATION, "invalid or missing authentication credentials");
        this.reason = reason;
    }

    public AuthenticationException(Reason reason, Throwable cause) {
        super(ErrorKind.AUTHENTICATION, "invalid or missing authentication credentials", cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
