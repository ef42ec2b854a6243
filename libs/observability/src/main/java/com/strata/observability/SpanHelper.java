package com.strata.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.Map;

/**
 * Thin wrapper over an OpenTelemetry {@link Tracer} that runs a unit of work inside a span.
 *
 * <p>The helper only uses the OTel API. The host configures the SDK (exporter, sampler); without
 * one every span is a no-op.
 */
public final class SpanHelper {

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /** A helper whose spans are discarded. */
    public static SpanHelper noop() {
        return new SpanHelper(OpenTelemetry.noop().getTracer("strata"));
    }

    /**
     * Runs {@code work} inside a new span of the given kind. The span records the exception and an
     * ERROR status when the work throws; the exception is rethrown unchanged.
     *
     * @param spanName span name, e.g. "subscription.deliver"
     * @param kind span kind
     * @param attributes string attributes set before the work starts
     * @param work the work to run
     */
    public <T, X extends Exception> T inSpan(
            String spanName, SpanKind kind, Map<String, String> attributes, SpanWork<T, X> work)
            throws X {
        var builder = tracer.spanBuilder(spanName).setSpanKind(kind);
        attributes.forEach(builder::setAttribute);
        Span span = builder.startSpan();

        try (Scope ignored = span.makeCurrent()) {
            T result = work.run(span);
            span.setStatus(StatusCode.OK);
            return result;
        } catch (Exception e) {
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Void variant of {@link #inSpan(String, SpanKind, Map, SpanWork)} for unchecked work.
     */
    public void inSpan(String spanName, SpanKind kind, Map<String, String> attributes, Runnable work) {
        inSpan(spanName, kind, attributes, span -> {
            work.run();
            return null;
        });
    }

    public Tracer tracer() {
        return tracer;
    }

    /**
     * Work executed inside a span; receives the span so it can add attributes or events.
     *
     * @param <T> result type
     * @param <X> checked exception the work may throw
     */
    @FunctionalInterface
    public interface SpanWork<T, X extends Exception> {
        T run(Span span) throws X;
    }
}
