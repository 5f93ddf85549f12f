package com.keystone.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that tags spans with the current
 * {@link RequestContext}. SDK configuration (exporter, sampler) is the hosting service's job.
 */
public final class SpanHelper {

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code work} inside a new internal span. Runtime exceptions mark the span as failed and
     * are rethrown unchanged.
     */
    public <T> T inSpan(String spanName, Map<String, String> attributes, Supplier<T> work) {
        var builder = tracer.spanBuilder(spanName);
        attributes.forEach(builder::setAttribute);
        Span span = builder.startSpan();

        RequestContextHolder.get().ifPresent(ctx -> {
            span.setAttribute("correlation.id", ctx.correlationId());
            if (ctx.organizationId() != null) {
                span.setAttribute("organization.id", ctx.organizationId());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getClass().getSimpleName());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
