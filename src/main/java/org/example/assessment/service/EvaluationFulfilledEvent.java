package org.example.assessment.service;

/**
 * Published by an {@link EvaluationNetwork} when a request has been scored.
 */
public record EvaluationFulfilledEvent(
        String requestId,
        byte[] rawResult
) {
}
