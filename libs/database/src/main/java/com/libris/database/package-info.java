/**
 * Persistence building blocks shared by Libris services: Flyway migrations, safelisted sorting,
 * pagination, and windowed-count search over Spring JDBC.
 */
package com.libris.database;
