package com.libris.security;

import com.libris.common.error.CatalogException;
import com.libris.common.error.ErrorKind;

/** The entropy source or the digest algorithm was unavailable. */
public class TokenGenerationException extends CatalogException {

    public TokenGenerationException(String message, Throwable cause) {
        super(ErrorKind.STORAGE, message, cause);
    }
}
