package com.insider.resolution.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        @Test
        @DisplayName("Span lifecycle should work without errors")
        void spanLifecycleNoErrors() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertDoesNotThrow(() -> {
                try (Span span = noOp.startSpan(TracingService.RESOLVE, Map.of("query", "gale klappa"))) {
                    span.tag("variants", 3L);
                    span.tag("confidence", 0.9);
                    span.event(TracingService.FALLBACK_UNAVAILABLE);
                    span.fail(new IllegalStateException("search down"));
                    span.fail(null);
                }
            });
        }

        @Test
        @DisplayName("Should hand out one shared span")
        void sameSpanReturned() {
            NoOpTracingService noOp = new NoOpTracingService();
            assertSame(noOp.startSpan(TracingService.INDEXED_SEARCH),
                    noOp.startSpan(TracingService.EXHAUSTIVE_SCAN));
        }
    }

    @Nested
    @DisplayName("Default tagging")
    class DefaultTaggingTests {

        @Test
        @DisplayName("startSpan with tags should apply each tag to the new span")
        void tagsAppliedToSpan() {
            List<String> recorded = new ArrayList<>();
            TracingService recording = operationName -> new Span() {
                @Override
                public void tag(String key, String value) {
                    recorded.add(operationName + ":" + key + "=" + value);
                }

                @Override
                public void tag(String key, long value) {
                }

                @Override
                public void tag(String key, double value) {
                }

                @Override
                public void event(String name) {
                }

                @Override
                public void succeed() {
                }

                @Override
                public void fail(Throwable cause) {
                }

                @Override
                public void close() {
                }
            };

            recording.startSpan(TracingService.RESOLVE, Map.of("query", "gale klappa"));
            recording.startSpan(TracingService.RESOLVE, null);

            assertEquals(List.of("insider.resolve:query=gale klappa"), recorded);
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    class OTelTests {

        private Tracer tracer;
        private SpanBuilder builder;
        private io.opentelemetry.api.trace.Span otelSpan;
        private OpenTelemetryTracingService service;

        @BeforeEach
        void setUp() {
            tracer = mock(Tracer.class);
            builder = mock(SpanBuilder.class);
            otelSpan = mock(io.opentelemetry.api.trace.Span.class);
            when(tracer.spanBuilder(anyString())).thenReturn(builder);
            when(builder.setSpanKind(any(SpanKind.class))).thenReturn(builder);
            when(builder.setAttribute(anyString(), anyString())).thenReturn(builder);
            when(builder.startSpan()).thenReturn(otelSpan);
            service = new OpenTelemetryTracingService(tracer);
        }

        @Test
        @DisplayName("Should open an internal span with namespaced initial tags")
        void createSpanWithTags() {
            Span span = service.startSpan(TracingService.RESOLVE, Map.of("query", "gale klappa"));

            assertNotNull(span);
            verify(tracer).spanBuilder("insider.resolve");
            verify(builder).setSpanKind(SpanKind.INTERNAL);
            verify(builder).setAttribute("insider.query", "gale klappa");
        }

        @Test
        @DisplayName("Should forward tags and events")
        void forwardsTags() {
            Span span = service.startSpan(TracingService.EXHAUSTIVE_SCAN);
            span.tag("scope", "all");
            span.tag("entities", 500L);
            span.tag("confidence", 0.9);
            span.event(TracingService.FALLBACK_EMPTY);

            verify(otelSpan).setAttribute("insider.scope", "all");
            verify(otelSpan).setAttribute("insider.entities", 500L);
            verify(otelSpan).setAttribute("insider.confidence", 0.9);
            verify(otelSpan).addEvent("fallback.empty");
        }

        @Test
        @DisplayName("succeed should set OK status")
        void succeedSetsOk() {
            service.startSpan(TracingService.INDEXED_SEARCH).succeed();

            verify(otelSpan).setStatus(StatusCode.OK);
        }

        @Test
        @DisplayName("fail without a cause should only set ERROR status")
        void failWithoutCause() {
            service.startSpan(TracingService.INDEXED_SEARCH).fail(null);

            verify(otelSpan).setStatus(StatusCode.ERROR);
            verify(otelSpan, never()).recordException(any(Throwable.class));
        }

        @Test
        @DisplayName("fail with a cause should record it and end the span on close")
        void failRecordsAndEnds() {
            RuntimeException ex = new RuntimeException("All 3 indexed queries failed");
            try (Span span = service.startSpan(TracingService.RESOLVE)) {
                span.fail(ex);
            }
            verify(otelSpan).recordException(ex);
            verify(otelSpan).setStatus(StatusCode.ERROR, "All 3 indexed queries failed");
            verify(otelSpan).end();
        }

        @Test
        @DisplayName("Should work against the no-op OpenTelemetry API")
        void noopOpenTelemetry() {
            OpenTelemetryTracingService real = new OpenTelemetryTracingService(OpenTelemetry.noop());
            assertDoesNotThrow(() -> {
                try (Span span = real.startSpan(TracingService.RESOLVE, Map.of("query", "x"))) {
                    span.succeed();
                }
            });
        }
    }
}
