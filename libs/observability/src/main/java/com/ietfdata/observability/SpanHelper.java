package com.ietfdata.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that attaches the current
 * {@link CorrelationContext} to every span.
 * <p>
 * Only the OTel API is used here. Applications configure the SDK (exporter, sampler, resource)
 * themselves; without one, spans are no-ops.
 */
public final class SpanHelper {

    /** Instrumentation scope name used for the client's tracer. */
    public static final String INSTRUMENTATION_NAME = "com.ietfdata.client";

    private final Tracer tracer;

    /**
     * Creates a SpanHelper backed by the given OTel tracer.
     *
     * @param tracer the OpenTelemetry tracer (typically obtained from {@code GlobalOpenTelemetry})
     */
    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Returns a helper whose spans are discarded.
     */
    public static SpanHelper noop() {
        return new SpanHelper(OpenTelemetry.noop().getTracer(INSTRUMENTATION_NAME));
    }

    /**
     * Runs {@code work} inside a {@link SpanKind#CLIENT} span.
     *
     * @param spanName   name for the span
     * @param attributes additional span attributes
     * @param work       the call to the remote service
     * @return the result of the work
     */
    public <T> T withClientSpan(String spanName, Map<String, String> attributes, Supplier<T> work) {
        return withSpan(spanName, SpanKind.CLIENT, attributes, work);
    }

    /**
     * Runs {@code work} inside a new span of the given kind. The span is ended automatically; a
     * runtime exception marks it as failed, is recorded on it and is rethrown unchanged.
     *
     * @param spanName   name for the span
     * @param kind       span kind
     * @param attributes additional span attributes
     * @param work       the work to execute within the span
     * @param <T>        return type
     * @return the result of the work
     */
    public <T> T withSpan(String spanName, SpanKind kind, Map<String, String> attributes, Supplier<T> work) {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(kind);
        attributes.forEach(spanBuilder::setAttribute);

        Span span = spanBuilder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute("correlation.id", ctx.correlationId());
            if (ctx.operation() != null) {
                span.setAttribute("datatracker.operation", ctx.operation());
            }
            if (ctx.target() != null) {
                span.setAttribute("datatracker.target", ctx.target());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Returns the underlying OTel tracer.
     */
    public Tracer tracer() {
        return tracer;
    }
}
