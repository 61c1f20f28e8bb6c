package org.example.assessment.service;

import java.util.List;

/**
 * Arguments are {@code [questionSetId, answersHash, contentHash]}.
 */
public record EvaluationRequest(
        long subscriptionId,
        byte[] encryptedSecrets,
        String donId,
        String sourceCode,
        List<String> args
) {
}
