package org.example.assessment.service.scoring;

/**
 * Thrown when a scoring model call fails or returns an unusable response.
 */
public class ScoringModelException extends RuntimeException {

    public ScoringModelException(String message) {
        super(message);
    }

    public ScoringModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
