package com.libris.database.jdbc;

import com.libris.database.query.Page;
import com.libris.database.query.PaginationPlanner;
import com.libris.database.query.QueryPlan;
import com.libris.database.query.SearchQuery;
import com.libris.database.query.SearchQueryBuilder;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * Executes a {@link SearchQuery} and assembles the {@link Page}: rows and metadata from a single
 * statement.
 *
 * <p>The statement timeout is the {@link JdbcTemplate}'s query timeout.
 */
public class PagedQueryExecutor {

    private final JdbcTemplate jdbcTemplate;

    public PagedQueryExecutor(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate");
    }

    /**
     * @param query     built statement
     * @param rowMapper maps the selected columns of one row; the total column is read here
     * @return the page; no rows gives an empty list with zero metadata
     */
    public <T> Page<T> fetch(SearchQuery query, RowMapper<T> rowMapper) {
        return DataAccessGuard.call("paged search", () -> {
            List<T> records = new ArrayList<>();
            long[] total = {0};
            jdbcTemplate.query(query.sql(), rs -> {
                total[0] = rs.getLong(SearchQueryBuilder.TOTAL_RECORDS_COLUMN);
                records.add(rowMapper.mapRow(rs, records.size()));
            }, query.args().toArray());

            QueryPlan plan = query.plan();
            return new Page<>(records,
                    PaginationPlanner.calculateMetadata(total[0], plan.page(), plan.pageSize()));
        });
    }
}
