package org.example.assessment.model;

import java.time.LocalDateTime;

public record AuditEvent(
        long sequence,
        String eventType,
        String actor,
        String payloadJson,
        String previousHash,
        String entryHash,
        LocalDateTime recordedAt
) {
}
