package com.libris.database.query;

import com.libris.common.error.ValidationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Closed set of sort values a listing endpoint accepts.
 *
 * <p>Entries are direction-qualified: {@code "title"} sorts ascending, {@code "-title"} descending.
 * Each entry's {@link SortSpec} is computed once, at construction, from the declared text and an
 * optional key → column mapping. {@link #validate(String)} only compares the client's value for
 * equality and hands back the precomputed {@link SortSpec}; client text never reaches the SQL.
 *
 * <pre>{@code
 * SortSafelist books = SortSafelist.of(
 *         Map.of("publishedYear", "published_year"),
 *         "id", "title", "publishedYear", "-id", "-title", "-publishedYear");
 * }</pre>
 */
public final class SortSafelist {

    public static final String DESCENDING_PREFIX = "-";

    private final Map<String, SortSpec> specs;

    private SortSafelist(String[] entries, Map<String, String> columnsByKey) {
        if (entries.length == 0) {
            throw new IllegalArgumentException("safelist must not be empty");
        }
        Map<String, SortSpec> computed = new LinkedHashMap<>();
        for (String entry : entries) {
            boolean descending = entry.startsWith(DESCENDING_PREFIX);
            String key = descending ? entry.substring(DESCENDING_PREFIX.length()) : entry;
            String column = SqlIdentifiers.require(columnsByKey.getOrDefault(key, key));
            computed.put(entry, new SortSpec(column, descending ? SortDirection.DESC : SortDirection.ASC));
        }
        this.specs = Collections.unmodifiableMap(computed);
    }

    /**
     * Safelist whose keys are column names.
     *
     * @param entries allowed sort values, each a bare key or a {@code -}-prefixed key
     * @throws IllegalArgumentException if no entry is given or a key is not a safe identifier
     */
    public static SortSafelist of(String... entries) {
        return new SortSafelist(entries, Map.of());
    }

    /**
     * Safelist whose keys may differ from the column they order by, e.g. the API key
     * {@code publishedYear} for column {@code published_year}.
     *
     * @param columnsByKey key → column for keys that are not column names themselves
     * @param entries      allowed sort values
     * @throws IllegalArgumentException if no entry is given or a column is not a safe identifier
     */
    public static SortSafelist of(Map<String, String> columnsByKey, String... entries) {
        return new SortSafelist(entries, columnsByKey);
    }

    /**
     * @param sortKey client-supplied sort value
     * @return the declared ordering for {@code sortKey}
     * @throws ValidationException on field {@code sort} when the value is not in the safelist
     */
    public SortSpec validate(String sortKey) {
        SortSpec spec = sortKey == null ? null : specs.get(sortKey);
        if (spec == null) {
            throw new ValidationException("sort", "invalid sort value");
        }
        return spec;
    }

    public boolean permits(String sortKey) {
        return sortKey != null && specs.containsKey(sortKey);
    }

    /** Allowed values in declaration order. */
    public Set<String> entries() {
        return specs.keySet();
    }
}
