package com.libris.common.error;

/** The addressed record does not exist (or a credential did not resolve). */
public class RecordNotFoundException extends CatalogException {

    public RecordNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
