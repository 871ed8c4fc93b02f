package com.libris.database.jdbc;

import com.libris.common.error.StorageException;
import com.libris.common.error.StorageTimeoutException;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;

/**
 * Runs a store operation and translates Spring's {@link DataAccessException} hierarchy into the
 * Libris error taxonomy.
 *
 * <ul>
 *   <li>deadline exceeded ({@link QueryTimeoutException}, SQLState {@value #QUERY_CANCELED}, or
 *       no pooled connection within the pool's connection timeout) → {@link StorageTimeoutException}
 *   <li>any other {@link DataAccessException} → {@link StorageException}
 * </ul>
 *
 * <p>Exceptions that are already domain errors pass through untouched, so callers map expected
 * failures such as duplicate keys inside {@code work}.
 */
public final class DataAccessGuard {

    private static final Logger log = LoggerFactory.getLogger(DataAccessGuard.class);

    /** PostgreSQL "query_canceled", raised when the statement timeout fires. */
    static final String QUERY_CANCELED = "57014";

    private DataAccessGuard() {
        // utility class
    }

    public static <T> T call(String operation, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException e) {
            if (isTimeout(e)) {
                log.warn("Storage operation '{}' exceeded its deadline", operation);
                throw new StorageTimeoutException(operation, e);
            }
            throw new StorageException("storage operation failed: " + operation, e);
        }
    }

    public static void run(String operation, Runnable work) {
        call(operation, () -> {
            work.run();
            return null;
        });
    }

    static boolean isTimeout(DataAccessException e) {
        if (e instanceof QueryTimeoutException) {
            return true;
        }
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql && QUERY_CANCELED.equals(sql.getSQLState())) {
                return true;
            }
            // HikariCP: "Connection is not available, request timed out after ..."
            if (t instanceof SQLTransientConnectionException) {
                return true;
            }
        }
        return false;
    }
}
