package org.example.assessment.model;

import java.time.LocalDateTime;

public record AssessmentView(
        String user,
        String questionSetId,
        String answersHash,
        String status,
        Integer score,
        String resultHash,
        String pendingRequestId,
        String rewardAmount,
        LocalDateTime startedAt,
        LocalDateTime completedAt
) {

    public AssessmentView withoutPendingRequestId() {
        if (pendingRequestId == null) {
            return this;
        }
        return new AssessmentView(user, questionSetId, answersHash, status, score, resultHash, null,
                rewardAmount, startedAt, completedAt);
    }
}
