/**
 * Spring JDBC adapters for the domain ports. Every statement runs through
 * {@link com.libris.database.jdbc.DataAccessGuard}, so callers only ever see Libris error kinds.
 */
package com.libris.catalog.infrastructure.persistence;
