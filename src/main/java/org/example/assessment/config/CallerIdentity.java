package org.example.assessment.config;

/**
 * Request header and attribute carrying the acting identity.
 */
public final class CallerIdentity {

    public static final String HEADER_NAME = "X-Caller-Id";
    public static final String ATTRIBUTE_NAME = "callerId";
    public static final String API_KEY_HEADER = "X-API-Key";
    public static final String ROUTER_KEY_HEADER = "X-Router-Key";

    private CallerIdentity() {
    }
}
