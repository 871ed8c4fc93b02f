package com.libris.catalog.infrastructure.web;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a controller parameter that receives the authenticated {@link
 * com.libris.catalog.domain.User}. A handler with such a parameter is only invoked for a request
 * carrying a valid AUTHENTICATION bearer token; otherwise the request fails with 401.
 *
 * @see AuthenticatedUserArgumentResolver
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface CurrentUser {}
