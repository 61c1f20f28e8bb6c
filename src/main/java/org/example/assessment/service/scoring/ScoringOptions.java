package org.example.assessment.service.scoring;

public record ScoringOptions(
    double temperature,
    Integer maxTokens   // nullable
) {
    /**
     * Low temperature so repeated grading of the same answers stays stable.
     */
    public static ScoringOptions deterministic() {
        return new ScoringOptions(0.0, 512);
    }
}
