package com.libris.catalog.api;

import com.libris.common.validation.FieldValidator;

/** Query-string parsing that reports failures on a {@link FieldValidator}. */
final class QueryParams {

    private QueryParams() {}

    /**
     * @return {@code fallback} when {@code raw} is absent or empty, the parsed value otherwise;
     *     records "must be an integer value" on {@code field} when {@code raw} is not an integer
     */
    static int readInt(String raw, int fallback, String field, FieldValidator v) {
        if (raw == null || raw.isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            v.addError(field, "must be an integer value");
            return fallback;
        }
    }

    static String readString(String raw, String fallback) {
        return raw == null || raw.isEmpty() ? fallback : raw;
    }
}
