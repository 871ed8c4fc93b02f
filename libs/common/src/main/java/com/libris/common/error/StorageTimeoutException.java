package com.libris.common.error;

/** A store operation was cancelled because its deadline elapsed. */
public class StorageTimeoutException extends CatalogException {

    public StorageTimeoutException(String operation, Throwable cause) {
        super(ErrorKind.TIMEOUT, "storage operation timed out: " + operation, cause);
    }
}
