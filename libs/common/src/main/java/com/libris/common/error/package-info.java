/**
 * Libris error taxonomy.
 *
 * <p>Every domain failure extends {@link com.libris.common.error.CatalogException} and reports an
 * {@link com.libris.common.error.ErrorKind}. Boundaries discriminate failures with a {@code switch}
 * on the kind instead of comparing exception identities.
 */
package com.libris.common.error;
