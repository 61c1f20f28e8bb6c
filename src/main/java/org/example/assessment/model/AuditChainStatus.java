package org.example.assessment.model;

public record AuditChainStatus(
        boolean valid,
        long eventCount,
        Long firstBrokenSequence
) {
}
