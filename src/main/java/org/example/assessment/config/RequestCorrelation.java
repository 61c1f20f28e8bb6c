package org.example.assessment.config;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.MDC;

import java.util.Optional;
import java.util.UUID;

/**
 * Correlation id of the request being served. It travels in {@code X-Request-Id}, as a request
 * attribute, and under the {@code requestId} MDC key so log lines and audit entries carry it.
 */
public final class RequestCorrelation {

    public static final String HEADER_NAME = "X-Request-Id";
    public static final String ATTRIBUTE_NAME = "requestId";
    public static final String UNKNOWN = "unknown";

    private static final int MAX_LENGTH = 80;

    private RequestCorrelation() {
    }

    /**
     * Sanitizes a client supplied id, generating a fresh one when nothing usable remains.
     */
    public static String fromHeader(String headerValue) {
        String sanitized = headerValue == null ? "" : headerValue.trim().replaceAll("[^A-Za-z0-9._:-]", "");
        if (sanitized.isEmpty()) {
            return UUID.randomUUID().toString();
        }
        return sanitized.length() > MAX_LENGTH ? sanitized.substring(0, MAX_LENGTH) : sanitized;
    }

    static void bind(HttpServletRequest request, String requestId) {
        request.setAttribute(ATTRIBUTE_NAME, requestId);
        MDC.put(ATTRIBUTE_NAME, requestId);
    }

    static void unbind() {
        MDC.remove(ATTRIBUTE_NAME);
    }

    /**
     * Id bound to the current thread, if any. Background work such as the scoring worker has none.
     */
    public static Optional<String> current() {
        String requestId = MDC.get(ATTRIBUTE_NAME);
        return requestId == null || requestId.isBlank() ? Optional.empty() : Optional.of(requestId);
    }

    public static String resolveRequestId(HttpServletRequest request) {
        if (request != null && request.getAttribute(ATTRIBUTE_NAME) instanceof String value && !value.isBlank()) {
            return value;
        }
        return current().orElse(UNKNOWN);
    }
}
