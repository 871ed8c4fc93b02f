package com.libris.observability;

/**
 * Request-scoped identifiers copied into every log line of a catalog request.
 *
 * <p>{@code correlationId} and {@code requestId} are set by the web filter, {@code userId} once the
 * bearer token resolves, and {@code traceId}/{@code spanId} while a {@link SpanHelper} span is
 * open.
 *
 * @param correlationId caller-supplied or generated {@code X-Correlation-ID}
 * @param userId        authenticated user, null for anonymous requests
 * @param requestId     generated per request
 * @param spanId        active OpenTelemetry span, null outside a recorded span
 * @param traceId       active OpenTelemetry trace, null outside a recorded span
 */
public record CorrelationContext(
        String correlationId,
        String userId,
        String requestId,
        String spanId,
        String traceId
) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_USER_ID = "userId";
    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_SPAN_ID = "spanId";
    public static final String MDC_TRACE_ID = "traceId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Context of a freshly received request: no user, no span yet. */
    public static CorrelationContext forRequest(String correlationId, String requestId) {
        return new CorrelationContext(correlationId, null, requestId, null, null);
    }

    public CorrelationContext withUserId(String newUserId) {
        return new CorrelationContext(correlationId, newUserId, requestId, spanId, traceId);
    }

    public CorrelationContext withSpan(String newTraceId, String newSpanId) {
        return new CorrelationContext(correlationId, userId, requestId, newSpanId, newTraceId);
    }
}
