/**
 * Servlet-layer infrastructure: correlation IDs, bearer authentication of {@code @CurrentUser}
 * parameters, and RFC 7807 error rendering.
 */
package com.libris.catalog.infrastructure.web;
