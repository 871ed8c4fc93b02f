package com.libris.common.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Client input failed one or more checks. Carries a field → message map so the caller can show
 * every problem at once.
 */
public class ValidationException extends CatalogException {

    private final Map<String, String> fieldErrors;

    public ValidationException(Map<String, String> fieldErrors) {
        super(ErrorKind.VALIDATION, "validation failed: " + fieldErrors);
        if (fieldErrors == null || fieldErrors.isEmpty()) {
            throw new IllegalArgumentException("fieldErrors must not be null or empty");
        }
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    /** Single-field shortcut, e.g. {@code new ValidationException("sort", "invalid sort value")}. */
    public ValidationException(String field, String message) {
        this(Map.of(field, message));
    }

    /** Field → message, in the order the checks failed. */
    public Map<String, String> fieldErrors() {
        return fieldErrors;
    }
}
