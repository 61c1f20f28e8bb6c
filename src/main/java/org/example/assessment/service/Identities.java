package org.example.assessment.service;

import java.util.Locale;

public final class Identities {

    public static final String ZERO = "0x0000000000000000000000000000000000000000";

    private static final int MAX_LENGTH = 120;

    private Identities() {
    }

    public static String normalize(String identity) {
        if (identity == null) {
            return null;
        }
        String normalized = identity.trim().toLowerCase(Locale.ROOT);
        return normalized.isEmpty() ? null : normalized;
    }

    /**
     * Normalizes and validates an identity; blank, over-long and zero identities are rejected.
     */
    public static String require(String identity) {
        String normalized = normalize(identity);
        if (normalized == null || normalized.length() > MAX_LENGTH || ZERO.equals(normalized)) {
            throw new AssessmentException(AssessmentError.INVALID_IDENTITY, "Identity is invalid: " + identity);
        }
        return normalized;
    }
}
