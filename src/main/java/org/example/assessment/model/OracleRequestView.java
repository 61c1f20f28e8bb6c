package org.example.assessment.model;

import java.time.LocalDateTime;

public record OracleRequestView(
        String requestId,
        String user,
        String questionSetId,
        LocalDateTime issuedAt
) {
}
