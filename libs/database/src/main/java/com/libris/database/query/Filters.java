package com.libris.database.query;

import com.libris.common.error.ValidationException;
import com.libris.common.validation.FieldValidator;
import java.util.Objects;

/**
 * Client-controlled listing parameters before validation.
 *
 * @param page     1-based page number
 * @param pageSize records per page
 * @param sort     requested sort value, e.g. {@code "-title"}
 * @param safelist sort values the endpoint accepts
 */
public record Filters(int page, int pageSize, String sort, SortSafelist safelist) {

    public Filters {
        Objects.requireNonNull(safelist, "safelist");
    }

    /**
     * Validates every parameter, reporting all failures together, and plans the page.
     *
     * @throws ValidationException with one entry per offending field
     */
    public QueryPlan plan(PaginationPlanner planner) {
        var v = new FieldValidator();
        planner.check(page, pageSize, v);
        v.check(safelist.permits(sort), "sort", "invalid sort value");
        v.throwIfInvalid();

        return new QueryPlan(safelist.validate(sort), planner.plan(page, pageSize), page, pageSize);
    }
}
