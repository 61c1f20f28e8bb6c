package org.example.assessment.model;

/**
 * Decoded scoring callback: a score in [0, 100] and the reference to the detailed result.
 */
public record EvaluationResult(
        int score,
        String resultHash
) {
}
