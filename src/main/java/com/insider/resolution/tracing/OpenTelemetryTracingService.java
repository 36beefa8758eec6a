package com.insider.resolution.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;
import java.util.Objects;

/**
 * {@link TracingService} backed by an OpenTelemetry {@link Tracer}. Tags are recorded as span
 * attributes under the {@code insider.} namespace.
 */
public class OpenTelemetryTracingService implements TracingService {

    static final String INSTRUMENTATION_NAME = "com.insider.resolution";
    static final String ATTRIBUTE_PREFIX = "insider.";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer is required");
    }

    public OpenTelemetryTracingService(OpenTelemetry openTelemetry) {
        this(openTelemetry.getTracer(INSTRUMENTATION_NAME));
    }

    @Override
    public Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> tags) {
        SpanBuilder builder = tracer.spanBuilder(operationName).setSpanKind(SpanKind.INTERNAL);
        if (tags != null) {
            tags.forEach((key, value) -> builder.setAttribute(ATTRIBUTE_PREFIX + key, value));
        }
        return new OtelSpan(builder.startSpan());
    }

    private record OtelSpan(io.opentelemetry.api.trace.Span delegate) implements Span {

        @Override
        public void tag(String key, String value) {
            delegate.setAttribute(ATTRIBUTE_PREFIX + key, value);
        }

        @Override
        public void tag(String key, long value) {
            delegate.setAttribute(ATTRIBUTE_PREFIX + key, value);
        }

        @Override
        public void tag(String key, double value) {
            delegate.setAttribute(ATTRIBUTE_PREFIX + key, value);
        }

        @Override
        public void event(String name) {
            delegate.addEvent(name);
        }

        @Override
        public void succeed() {
            delegate.setStatus(StatusCode.OK);
        }

        @Override
        public void fail(Throwable cause) {
            if (cause == null) {
                delegate.setStatus(StatusCode.ERROR);
                return;
            }
            delegate.recordException(cause);
            delegate.setStatus(StatusCode.ERROR, String.valueOf(cause.getMessage()));
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
