package org.example.assessment.model;

public record OracleConfigView(
        long subscriptionId,
        String donId,
        boolean secretsConfigured,
        String evaluationSource,
        boolean sourceConfigured,
        String networkName,
        boolean networkAvailable,
        long outstandingRequests
) {
}
