package com.libris.catalog.infrastructure.web;

import com.libris.catalog.domain.User;
import com.libris.catalog.domain.service.TokenService;
import com.libris.common.error.AuthenticationException;
import com.libris.observability.CorrelationContextHolder;
import com.libris.observability.MetricFactory;
import com.libris.security.BearerAuthenticator;
import java.util.Locale;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Resolves {@link CurrentUser} parameters by authenticating the request's bearer token.
 *
 * <p>On success the user id is bound to the correlation context, so later log lines of the request
 * carry it.
 */
@Component
public class AuthenticatedUserArgumentResolver implements HandlerMethodArgumentResolver {

    private final BearerAuthenticator<User> authenticator;
    private final MetricFactory metrics;

    public AuthenticatedUserArgumentResolver(BearerAuthenticator<User> authenticator, MetricFactory metrics) {
        this.authenticator = authenticator;
        this.metrics = metrics;
    }

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(CurrentUser.class)
                && User.class.isAssignableFrom(parameter.getParameterType());
    }

    @Override
    public User resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        User user;
        try {
            user = authenticator.authenticate(webRequest.getHeader(HttpHeaders.AUTHORIZATION));
        } catch (AuthenticationException e) {
            String reason = e.reason().name().toLowerCase(Locale.ROOT);
            metrics.counter(TokenService.AUTH_FAILURES_METRIC, "Rejected credentials", "reason", reason)
                    .increment();
            throw e;
        }
        CorrelationContextHolder.bindUser(String.valueOf(user.id()));
        return user;
    }
}
