package com.disease.normalization.tracing;

import java.util.Map;

/**
 * {@link TracingService} that hands out a single shared span which records nothing.
 */
public class NoOpTracingService implements TracingService {

    private static final Span DISCARDING_SPAN = new DiscardingSpan();

    @Override
    public Span startSpan(String operationName) {
        return DISCARDING_SPAN;
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return DISCARDING_SPAN;
    }

    private static final class DiscardingSpan implements Span {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void setStatus(SpanStatus status) {
        }

        @Override
        public void recordException(Throwable t) {
        }

        @Override
        public void close() {
        }
    }
}
