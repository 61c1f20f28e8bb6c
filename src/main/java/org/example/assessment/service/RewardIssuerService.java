package org.example.assessment.service;

import org.example.assessment.model.RewardConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;

/**
 * Converts a score into a reward proportional to it and credits it on the points ledger.
 * The passing threshold is informational only and never gates the reward.
 */
@Service
public class RewardIssuerService {

    private static final Logger log = LoggerFactory.getLogger(RewardIssuerService.class);
    private static final BigInteger HUNDRED = BigInteger.valueOf(100);

    private final PointsLedger pointsLedger;
    private final LedgerSettingsService settingsService;
    private final AuditEventService auditEventService;
    private final LedgerSequencer sequencer;
    private final String issuerIdentity;

    public RewardIssuerService(
            PointsLedger pointsLedger,
            LedgerSettingsService settingsService,
            AuditEventService auditEventService,
            LedgerSequencer sequencer,
            @Value("${rewards.issuer-identity:assessment-manager}") String issuerIdentity) {
        this.pointsLedger = pointsLedger;
        this.settingsService = settingsService;
        this.auditEventService = auditEventService;
        this.sequencer = sequencer;
        this.issuerIdentity = Identities.require(issuerIdentity);
    }

    /**
     * Credits {@code floor(maxRewardUnits * score / 100)} to the user. A zero reward is still
     * passed to the ledger, which accepts it as a no-op.
     *
     * @return the credited amount
     */
    public BigInteger issueReward(String user, int score) {
        return sequencer.execute(() -> {
            BigInteger reward = computeReward(score);
            pointsLedger.credit(issuerIdentity, user, reward);
            log.info("Issued reward {} to {} for score {}", reward, user, score);
            return reward;
        });
    }

    @Transactional(readOnly = true)
    public BigInteger computeReward(int score) {
        int clamped = EvaluationResultDecoder.clampScore(score);
        return settingsService.getMaxRewardUnits()
                .multiply(BigInteger.valueOf(clamped))
                .divide(HUNDRED);
    }

    @Transactional(readOnly = true)
    public boolean isPassing(int score) {
        return score >= settingsService.getPassingScoreThreshold();
    }

    @Transactional(readOnly = true)
    public RewardConfig getRewardConfig() {
        return new RewardConfig(
                settingsService.getPassingScoreThreshold(),
                settingsService.getMaxRewardUnits().toString());
    }

    public RewardConfig setPassingScoreThreshold(String actor, int threshold) {
        return sequencer.execute(() -> {
            settingsService.requireOwner(actor);
            if (threshold < 0 || threshold > 100) {
                throw new AssessmentException(AssessmentError.INVALID_THRESHOLD);
            }
            int previous = settingsService.getPassingScoreThreshold();
            settingsService.update(settings -> settings.setPassingScoreThreshold(threshold));
            log.info("Passing score threshold changed from {} to {}", previous, threshold);
            auditEventService.record("PassingScoreThresholdUpdated", Identities.normalize(actor),
                    AuditEventService.fields("previous", previous, "threshold", threshold));
            return getRewardConfig();
        });
    }

    public RewardConfig setMaxRewardUnits(String actor, BigInteger maxRewardUnits) {
        return sequencer.execute(() -> {
            settingsService.requireOwner(actor);
            if (maxRewardUnits == null || maxRewardUnits.signum() < 0
                    || maxRewardUnits.compareTo(PointsLedger.MAX_AMOUNT) > 0) {
                throw new AssessmentException(AssessmentError.INVALID_REWARD_AMOUNT);
            }
            BigInteger previous = settingsService.getMaxRewardUnits();
            settingsService.update(settings -> settings.setMaxRewardUnits(maxRewardUnits));
            log.info("Max reward units changed from {} to {}", previous, maxRewardUnits);
            auditEventService.record("MaxRewardUpdated", Identities.normalize(actor),
                    AuditEventService.fields("previous", previous.toString(), "maxRewardUnits", maxRewardUnits.toString()));
            return getRewardConfig();
        });
    }
}
