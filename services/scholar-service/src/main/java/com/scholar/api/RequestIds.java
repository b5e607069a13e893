package com.scholar.api;

import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;

/** Correlation ids echoed on every response. Missing or blank headers get a fresh UUID. */
public record RequestIds(String traceId, String requestId) {
    static final String TRACE_HEADER = "x-trace-id";
    static final String REQUEST_HEADER = "x-request-id";

    public static RequestIds of(String traceHeader, String requestHeader) {
        return new RequestIds(orRandom(traceHeader), orRandom(requestHeader));
    }

    public static RequestIds from(HttpServletRequest request) {
        return of(request.getHeader(TRACE_HEADER), request.getHeader(REQUEST_HEADER));
    }

    private static String orRandom(String value) {
        return value == null || value.isBlank() ? UUID.randomUUID().toString() : value.trim();
    }
}
