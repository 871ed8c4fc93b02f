/** JdbcTemplate execution helpers and data-access error translation. */
package com.libris.database.jdbc;
