package com.libris.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Runs work inside an OpenTelemetry span.
 *
 * <p>The span carries the request's correlation and user ids as attributes. While it is open, its
 * trace and span ids are bound to the {@link CorrelationContextHolder}, so log lines written inside
 * the work can be matched to the trace. With the no-op tracer the span context is invalid and the
 * log context is left alone.
 */
public final class SpanHelper {

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    public <T> T inSpan(String spanName, Supplier<T> work) {
        return inSpan(spanName, Map.of(), work);
    }

    /**
     * Starts an internal span named {@code spanName}, runs {@code work} and ends the span. A thrown
     * {@link RuntimeException} marks the span as an error and is rethrown.
     *
     * @param attributes extra span attributes
     */
    public <T> T inSpan(String spanName, Map<String, String> attributes, Supplier<T> work) {
        SpanBuilder builder = tracer.spanBuilder(spanName);
        attributes.forEach(builder::setAttribute);
        Optional<CorrelationContext> outer = CorrelationContextHolder.get();
        outer.ifPresent(ctx -> {
            builder.setAttribute("correlation.id", ctx.correlationId());
            if (ctx.userId() != null) {
                builder.setAttribute("user.id", ctx.userId());
            }
        });

        Span span = builder.startSpan();
        SpanContext spanContext = span.getSpanContext();
        if (spanContext.isValid()) {
            outer.ifPresent(ctx ->
                    CorrelationContextHolder.set(ctx.withSpan(spanContext.getTraceId(), spanContext.getSpanId())));
        }

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
            outer.ifPresent(before -> CorrelationContextHolder.get().ifPresent(current ->
                    CorrelationContextHolder.set(current.withSpan(before.traceId(), before.spanId()))));
        }
    }
}
