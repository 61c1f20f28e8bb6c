package org.example.assessment.service;

import org.example.assessment.entity.LedgerSettingsEntity;
import org.example.assessment.repository.LedgerSettingsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.function.Consumer;

/**
 * Global settings row: the administrative owner plus the owner-mutable reward and verification switches.
 * Until the row is first written, reads fall back to the configured defaults.
 */
@Service
public class LedgerSettingsService {

    private static final Logger log = LoggerFactory.getLogger(LedgerSettingsService.class);

    private final LedgerSettingsRepository settingsRepository;
    private final AuditEventService auditEventService;
    private final LedgerSequencer sequencer;
    private final String defaultOwner;
    private final int defaultPassingScoreThreshold;
    private final BigInteger defaultMaxRewardUnits;
    private final boolean defaultOracleVerificationEnabled;

    public LedgerSettingsService(
            LedgerSettingsRepository settingsRepository,
            AuditEventService auditEventService,
            LedgerSequencer sequencer,
            @Value("${ledger.owner}") String defaultOwner,
            @Value("${rewards.passing-score-threshold:70}") int defaultPassingScoreThreshold,
            @Value("${rewards.max-reward-units:1000000000000000000}") BigInteger defaultMaxRewardUnits,
            @Value("${assessment.oracle-verification-enabled:true}") boolean defaultOracleVerificationEnabled) {
        this.settingsRepository = settingsRepository;
        this.auditEventService = auditEventService;
        this.sequencer = sequencer;
        this.defaultOwner = Identities.require(defaultOwner);
        this.defaultPassingScoreThreshold = defaultPassingScoreThreshold;
        this.defaultMaxRewardUnits = defaultMaxRewardUnits;
        this.defaultOracleVerificationEnabled = defaultOracleVerificationEnabled;
    }

    /**
     * Writes the settings row from configured defaults if it does not exist yet.
     *
     * @return true if the row was created by this call
     */
    public boolean ensureInitialized() {
        return sequencer.execute(() -> {
            if (settingsRepository.existsById(LedgerSettingsEntity.GLOBAL_ID)) {
                return false;
            }
            LedgerSettingsEntity settings = settingsRepository.save(defaults());
            log.info("Ledger settings initialized: owner={}, threshold={}, maxRewardUnits={}",
                    settings.getOwnerId(), settings.getPassingScoreThreshold(), settings.getMaxRewardUnits());
            auditEventService.record("OwnershipTransferred", null, AuditEventService.fields(
                    "previousOwner", Identities.ZERO,
                    "newOwner", settings.getOwnerId()));
            return true;
        });
    }

    @Transactional(readOnly = true)
    public String getOwner() {
        return current().getOwnerId();
    }

    @Transactional(readOnly = true)
    public boolean isOwner(String identity) {
        String normalized = Identities.normalize(identity);
        return normalized != null && normalized.equals(current().getOwnerId());
    }

    public void requireOwner(String actor) {
        if (!isOwner(actor)) {
            throw new AssessmentException(AssessmentError.NOT_OWNER, "Ownable: caller is not the owner");
        }
    }

    public String transferOwnership(String actor, String newOwner) {
        return sequencer.execute(() -> {
            requireOwner(actor);
            String normalizedOwner = Identities.require(newOwner);
            String previousOwner = current().getOwnerId();
            update(settings -> settings.setOwnerId(normalizedOwner));
            log.info("Ownership transferred from {} to {}", previousOwner, normalizedOwner);
            auditEventService.record("OwnershipTransferred", Identities.normalize(actor), AuditEventService.fields(
                    "previousOwner", previousOwner,
                    "newOwner", normalizedOwner));
            return normalizedOwner;
        });
    }

    @Transactional(readOnly = true)
    public int getPassingScoreThreshold() {
        return current().getPassingScoreThreshold();
    }

    @Transactional(readOnly = true)
    public BigInteger getMaxRewardUnits() {
        return current().getMaxRewardUnits();
    }

    @Transactional(readOnly = true)
    public boolean isOracleVerificationEnabled() {
        return current().isOracleVerificationEnabled();
    }

    /**
     * Applies a change to the settings row; callers hold the sequencer.
     */
    public LedgerSettingsEntity update(Consumer<LedgerSettingsEntity> change) {
        LedgerSettingsEntity settings = current();
        change.accept(settings);
        settings.touch();
        return settingsRepository.save(settings);
    }

    private LedgerSettingsEntity current() {
        return settingsRepository.findById(LedgerSettingsEntity.GLOBAL_ID).orElseGet(this::defaults);
    }

    private LedgerSettingsEntity defaults() {
        LedgerSettingsEntity settings = new LedgerSettingsEntity();
        settings.setId(LedgerSettingsEntity.GLOBAL_ID);
        settings.setOwnerId(defaultOwner);
        settings.setPassingScoreThreshold(defaultPassingScoreThreshold);
        settings.setMaxRewardUnits(defaultMaxRewardUnits);
        settings.setOracleVerificationEnabled(defaultOracleVerificationEnabled);
        return settings;
    }
}
