package org.example.assessment.model;

import java.time.LocalDateTime;

public record QuestionSetMetadata(
        String setId,
        String contentHash,
        int questionCount,
        boolean active,
        LocalDateTime submittedAt
) {
}
