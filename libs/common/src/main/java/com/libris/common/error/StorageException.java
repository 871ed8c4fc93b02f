package com.libris.common.error;

/** Any other storage or infrastructure failure (connectivity, entropy source, digest). */
public class StorageException extends CatalogException {

    public StorageException(String message, Throwable cause) {
        super(ErrorKind.STORAGE, message, cause);
    }
}
