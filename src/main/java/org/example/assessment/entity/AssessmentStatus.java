package org.example.assessment.entity;

public enum AssessmentStatus {
    NOT_STARTED,
    STARTED,
    ANSWERS_SUBMITTED,
    VERIFYING,
    COMPLETED
}
