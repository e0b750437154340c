package com.disease.normalization.tracing;

/**
 * One traced unit of normalizer work. Closing the span ends it, so spans are
 * opened in try-with-resources:
 *
 * <pre>
 * try (Span span = tracingService.startSpan(TracingService.NORMALIZE)) {
 *     span.setAttribute("matchType", result.matchType().name());
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
