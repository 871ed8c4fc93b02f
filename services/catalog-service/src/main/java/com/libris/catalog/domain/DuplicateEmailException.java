package com.libris.catalog.domain;

import com.libris.common.error.ValidationException;

/** Registration or update hit the unique email constraint. */
public class DuplicateEmailException extends ValidationException {

    public static final String MESSAGE = "a user with this email address already exists";

    public DuplicateEmailException() {
        super("email", MESSAGE);
    }
}
