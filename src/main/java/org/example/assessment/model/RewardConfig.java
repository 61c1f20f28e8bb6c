package org.example.assessment.model;

public record RewardConfig(
        int passingScoreThreshold,
        String maxRewardUnits
) {
}
