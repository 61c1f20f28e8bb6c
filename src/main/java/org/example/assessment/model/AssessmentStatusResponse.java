package org.example.assessment.model;

public record AssessmentStatusResponse(
        String user,
        boolean hasAssessment,
        String questionSetId,
        String status,
        boolean completed,
        Integer score,
        boolean passed
) {
}
