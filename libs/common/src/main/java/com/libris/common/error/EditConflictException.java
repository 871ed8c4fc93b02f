package com.libris.common.error;

/**
 * A write lost a race: the row's version moved since it was read, or a unique key collided.
 * The caller may re-read and reapply.
 */
public class EditConflictException extends CatalogException {

    public EditConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }

    public EditConflictException(String message, Throwable cause) {
        super(ErrorKind.CONFLICT, message, cause);
    }
}
