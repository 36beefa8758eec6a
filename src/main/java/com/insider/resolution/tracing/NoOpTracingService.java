package com.insider.resolution.tracing;

/**
 * Tracing that records nothing.
 */
public class NoOpTracingService implements TracingService {

    @Override
    public Span startSpan(String operationName) {
        return SilentSpan.INSTANCE;
    }

    private enum SilentSpan implements Span {
        INSTANCE;

        @Override
        public void tag(String key, String value) {
            // nothing recorded
        }

        @Override
        public void tag(String key, long value) {
            // nothing recorded
        }

        @Override
        public void tag(String key, double value) {
            // nothing recorded
        }

        @Override
        public void event(String name) {
            // nothing recorded
        }

        @Override
        public void succeed() {
            // nothing recorded
        }

        @Override
        public void fail(Throwable cause) {
            // nothing recorded
        }

        @Override
        public void close() {
            // nothing to end
        }
    }
}
