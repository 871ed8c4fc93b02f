package com.libris.observability;

import java.util.Optional;
import org.slf4j.MDC;

/**
 * Keeps the current request's {@link CorrelationContext} in a ThreadLocal and mirrors each of its
 * fields into the SLF4J MDC, where {@code logback-spring.xml} prints them.
 *
 * <p>Request handling is thread-per-request; nothing here crosses to other threads.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private static final String[] MDC_KEYS = {
        CorrelationContext.MDC_CORRELATION_ID,
        CorrelationContext.MDC_USER_ID,
        CorrelationContext.MDC_REQUEST_ID,
        CorrelationContext.MDC_SPAN_ID,
        CorrelationContext.MDC_TRACE_ID
    };

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * @throws IllegalArgumentException if {@code context} is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        putOrRemove(CorrelationContext.MDC_CORRELATION_ID, context.correlationId());
        putOrRemove(CorrelationContext.MDC_USER_ID, context.userId());
        putOrRemove(CorrelationContext.MDC_REQUEST_ID, context.requestId());
        putOrRemove(CorrelationContext.MDC_SPAN_ID, context.spanId());
        putOrRemove(CorrelationContext.MDC_TRACE_ID, context.traceId());
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Adds the authenticated user to the current context. Does nothing outside a request, e.g. when
     * a service is called directly from a test.
     */
    public static void bindUser(String userId) {
        CorrelationContext current = CONTEXT.get();
        if (current != null) {
            set(current.withUserId(userId));
        }
    }

    public static void clear() {
        CONTEXT.remove();
        for (String key : MDC_KEYS) {
            MDC.remove(key);
        }
    }

    private static void putOrRemove(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }
}
