package com.insider.resolution.tracing;

import java.util.Map;

/**
 * Tracing seam for the resolver. {@link NoOpTracingService} is used when no backend is
 * configured.
 */
public interface TracingService {

    String RESOLVE = "insider.resolve";
    String INDEXED_SEARCH = "insider.indexed_search";
    String EXHAUSTIVE_SCAN = "insider.exhaustive_scan";

    /** Event on the resolve span when the search succeeded without matches. */
    String FALLBACK_EMPTY = "fallback.empty";
    /** Event on the resolve span when the search could not be used. */
    String FALLBACK_UNAVAILABLE = "fallback.unavailable";

    Span startSpan(String operationName);

    default Span startSpan(String operationName, Map<String, String> tags) {
        Span span = startSpan(operationName);
        if (tags != null) {
            tags.forEach(span::tag);
        }
        return span;
    }
}
