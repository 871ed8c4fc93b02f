package com.libris.common.validation;

import com.libris.common.error.ValidationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Collects field-level validation failures and raises them together.
 *
 * <p>Only the first failure per field is kept. Not thread-safe; create one per request.
 *
 * <pre>{@code
 * var v = new FieldValidator();
 * v.check(!title.isBlank(), "title", "must be provided");
 * v.check(title.length() <= 100, "title", "must not be more than 100 bytes long");
 * v.throwIfInvalid();
 * }</pre>
 */
public final class FieldValidator {

    /** Pragmatic email shape check (the HTML5 living standard pattern). */
    public static final Pattern EMAIL =
            Pattern.compile(
                    "^[a-zA-Z0-9.!#$%&'*+/=?^_`{|}~-]+@[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?"
                            + "(?:\\.[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?)*$");

    private final Map<String, String> errors = new LinkedHashMap<>();

    /**
     * Records {@code message} for {@code field} unless {@code ok} holds.
     *
     * @return this validator, for chaining
     */
    public FieldValidator check(boolean ok, String field, String message) {
        if (!ok) {
            addError(field, message);
        }
        return this;
    }

    /** Records an error unless the field already has one. */
    public void addError(String field, String message) {
        errors.putIfAbsent(field, message);
    }

    public boolean valid() {
        return errors.isEmpty();
    }

    public Map<String, String> errors() {
        return Collections.unmodifiableMap(errors);
    }

    /**
     * @throws ValidationException carrying every recorded error, if any
     */
    public void throwIfInvalid() {
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    public static boolean matches(String value, Pattern pattern) {
        return value != null && pattern.matcher(value).matches();
    }
}
