package com.disease.normalization.tracing;

import java.util.Map;

/**
 * Opens spans around rebuilds and queries.
 * {@link NoOpTracingService} is used unless a tracer is configured.
 */
public interface TracingService {

    String REBUILD = "disease.rebuild";
    String NORMALIZE = "disease.normalize";
    String SEARCH = "disease.search";
    String IMPORT = "disease.import";

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);
}
