/**
 * Domain layer: catalog records, accounts, persistence ports and application services.
 *
 * <p>Domain types do not depend on the {@code api} or {@code infrastructure} packages; the JDBC
 * adapters in {@code infrastructure.persistence} implement the ports declared here.
 */
package com.libris.catalog.domain;
