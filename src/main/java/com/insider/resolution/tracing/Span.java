package com.insider.resolution.tracing;

/**
 * One traced step of a resolution. Closing the span ends it, so it is meant for
 * try-with-resources:
 *
 * <pre>
 * try (Span span = tracing.startSpan(TracingService.RESOLVE)) {
 *     span.tag("variants", 5L);
 *     span.succeed();
 * }
 * </pre>
 *
 * A span that is closed without {@link #succeed()} or {@link #fail(Throwable)} keeps the
 * backend's default status.
 */
public interface Span extends AutoCloseable {

    void tag(String key, String value);

    void tag(String key, long value);

    void tag(String key, double value);

    void event(String name);

    void succeed();

    /**
     * Marks the span failed. {@code cause} may be null when the failure is a result
     * rather than an exception.
     */
    void fail(Throwable cause);

    @Override
    void close();
}
