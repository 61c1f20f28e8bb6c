package org.example.assessment.service;

import org.example.assessment.entity.AssessmentEntity;
import org.example.assessment.entity.AssessmentStatus;
import org.example.assessment.entity.QuestionSetEntity;
import org.example.assessment.model.AssessmentStatusResponse;
import org.example.assessment.model.AssessmentView;
import org.example.assessment.repository.AssessmentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-user assessment lifecycle:
 * NOT_STARTED -> STARTED -> ANSWERS_SUBMITTED -> VERIFYING -> COMPLETED, with restart back to NOT_STARTED.
 * Completion is reachable only through {@link EvaluationOracleService}.
 */
@Service
public class AssessmentService {

    private static final Logger log = LoggerFactory.getLogger(AssessmentService.class);

    private final AssessmentRepository assessmentRepository;
    private final QuestionCatalogService catalogService;
    private final EvaluationOracleService oracleService;
    private final RewardIssuerService rewardIssuer;
    private final LedgerSettingsService settingsService;
    private final AuditEventService auditEventService;
    private final LedgerSequencer sequencer;
    private final String managerIdentity;

    public AssessmentService(
            AssessmentRepository assessmentRepository,
            QuestionCatalogService catalogService,
            EvaluationOracleService oracleService,
            RewardIssuerService rewardIssuer,
            LedgerSettingsService settingsService,
            AuditEventService auditEventService,
            LedgerSequencer sequencer,
            @Value("${assessment.manager-identity:assessment-manager}") String managerIdentity) {
        this.assessmentRepository = assessmentRepository;
        this.catalogService = catalogService;
        this.oracleService = oracleService;
        this.rewardIssuer = rewardIssuer;
        this.settingsService = settingsService;
        this.auditEventService = auditEventService;
        this.sequencer = sequencer;
        this.managerIdentity = Identities.require(managerIdentity);
    }

    public AssessmentView start(String user, String questionSetId) {
        return sequencer.execute(() -> {
            String userId = Identities.require(user);
            QuestionSetEntity questionSet = catalogService.requireQuestionSet(questionSetId);
            if (!questionSet.isActive()) {
                throw new AssessmentException(AssessmentError.SET_INACTIVE,
                        "Question set is not active: " + questionSet.getSetId());
            }

            AssessmentEntity assessment = assessmentRepository.findById(userId)
                    .orElseGet(() -> new AssessmentEntity(userId));
            if (assessment.getStatus() != AssessmentStatus.NOT_STARTED) {
                throw new AssessmentException(AssessmentError.ALREADY_IN_PROGRESS,
                        "Assessment already in progress for set " + assessment.getQuestionSetId());
            }

            assessment.reset();
            assessment.setQuestionSetId(questionSet.getSetId());
            assessment.setStatus(AssessmentStatus.STARTED);
            assessment.setStartedAt(LocalDateTime.now());
            assessment = assessmentRepository.save(assessment);
            log.info("Assessment started for {} on set {}", userId, questionSet.getSetId());
            auditEventService.record("AssessmentStarted", userId, AuditEventService.fields(
                    "user", userId,
                    "questionSetId", questionSet.getSetId()));
            return toView(assessment);
        });
    }

    public AssessmentView submitAnswers(String user, String answersHash) {
        return sequencer.execute(() -> {
            String userId = Identities.require(user);
            AssessmentEntity assessment = assessmentRepository.findById(userId)
                    .orElseThrow(() -> new AssessmentException(AssessmentError.NO_ACTIVE_ASSESSMENT));
            return toView(applyAnswers(assessment, answersHash));
        });
    }

    /**
     * Submits answers if needed and requests verification. With oracle verification disabled the
     * assessment stays in ANSWERS_SUBMITTED until the owner supplies a manual result.
     *
     * @param actor the user or the owner
     * @param answersHash required from STARTED; optional from ANSWERS_SUBMITTED, where it must match
     */
    public AssessmentView submitAssessment(String actor, String user, String answersHash) {
        return sequencer.execute(() -> {
            String userId = Identities.require(user);
            String actorId = Identities.normalize(actor);
            if (!userId.equals(actorId) && !settingsService.isOwner(actorId)) {
                throw new AssessmentException(AssessmentError.NOT_OWNER, "Only the user or the owner may submit");
            }

            AssessmentEntity assessment = assessmentRepository.findById(userId)
                    .orElseThrow(() -> new AssessmentException(AssessmentError.NO_ACTIVE_ASSESSMENT));
            switch (assessment.getStatus()) {
                case NOT_STARTED -> throw new AssessmentException(AssessmentError.NO_ACTIVE_ASSESSMENT);
                case VERIFYING -> throw new AssessmentException(AssessmentError.ALREADY_VERIFYING);
                case COMPLETED -> throw new AssessmentException(AssessmentError.ALREADY_COMPLETED);
                case STARTED -> assessment = applyAnswers(assessment, answersHash);
                case ANSWERS_SUBMITTED -> {
                    if (answersHash != null && !answersHash.isBlank()
                            && !requireAnswersHash(answersHash).equals(assessment.getAnswersHash())) {
                        throw new AssessmentException(AssessmentError.ALREADY_SUBMITTED,
                                "Different answers already submitted");
                    }
                }
            }

            if (!settingsService.isOracleVerificationEnabled()) {
                log.info("Oracle verification disabled; assessment for {} awaits a manual result", userId);
                return toView(assessment);
            }

            QuestionSetEntity questionSet = catalogService.requireQuestionSet(assessment.getQuestionSetId());
            String requestId = oracleService.requestEvaluation(
                    managerIdentity,
                    userId,
                    questionSet.getSetId(),
                    assessment.getAnswersHash(),
                    questionSet.getContentHash());

            assessment.setPendingRequestId(requestId);
            assessment.setStatus(AssessmentStatus.VERIFYING);
            assessment = assessmentRepository.save(assessment);
            auditEventService.record("VerificationRequested", actorId, AuditEventService.fields(
                    "user", userId,
                    "questionSetId", questionSet.getSetId(),
                    "requestId", requestId));
            return toView(assessment);
        });
    }

    /**
     * Completes a verified assessment and issues its reward. Only the oracle client calls this.
     *
     * @param requestId the consumed request, or null for a manual result
     */
    public AssessmentView onVerificationComplete(String user, int score, String resultHash, String requestId) {
        return sequencer.execute(() -> {
            AssessmentEntity assessment = assessmentRepository.findById(user)
                    .orElseThrow(() -> new AssessmentException(AssessmentError.NO_ACTIVE_ASSESSMENT));
            switch (assessment.getStatus()) {
                case NOT_STARTED -> throw new AssessmentException(AssessmentError.NO_ACTIVE_ASSESSMENT);
                case STARTED -> throw new AssessmentException(AssessmentError.ANSWERS_NOT_SUBMITTED);
                case COMPLETED -> throw new AssessmentException(AssessmentError.ALREADY_COMPLETED);
                case ANSWERS_SUBMITTED, VERIFYING -> {
                    // completable
                }
            }
            if (requestId != null && !requestId.equals(assessment.getPendingRequestId())) {
                throw new AssessmentException(AssessmentError.UNKNOWN_REQUEST,
                        "Request " + requestId + " does not belong to the current assessment");
            }

            int clamped = EvaluationResultDecoder.clampScore(score);
            BigInteger reward = rewardIssuer.issueReward(user, clamped);
            boolean passed = rewardIssuer.isPassing(clamped);

            assessment.setScore(clamped);
            assessment.setResultHash(resultHash);
            assessment.setRewardAmount(reward);
            assessment.setPendingRequestId(null);
            assessment.setStatus(AssessmentStatus.COMPLETED);
            assessment.setCompletedAt(LocalDateTime.now());
            assessment = assessmentRepository.save(assessment);
            log.info("Assessment completed for {}: score={}, reward={}, passed={}", user, clamped, reward, passed);
            auditEventService.record("AssessmentCompleted", null, AuditEventService.fields(
                    "user", user,
                    "questionSetId", assessment.getQuestionSetId(),
                    "score", clamped,
                    "resultHash", resultHash,
                    "reward", reward.toString(),
                    "passed", passed,
                    "requestId", requestId));
            return toView(assessment);
        });
    }

    /**
     * Resets the user's assessment to NOT_STARTED from any state and cancels any outstanding
     * verification request, so a late callback for it is rejected.
     */
    public AssessmentView restart(String actor, String user) {
        return sequencer.execute(() -> {
            String userId = Identities.require(user);
            String actorId = Identities.normalize(actor);
            if (!userId.equals(actorId) && !settingsService.isOwner(actorId)) {
                throw new AssessmentException(AssessmentError.NOT_OWNER, "Only the user or the owner may restart");
            }
            AssessmentEntity assessment = assessmentRepository.findById(userId)
                    .orElseThrow(() -> new AssessmentException(AssessmentError.NO_ASSESSMENT));

            AssessmentStatus previousStatus = assessment.getStatus();
            String previousSet = assessment.getQuestionSetId();
            int cancelled = oracleService.cancelOutstandingRequests(userId, "restart");
            assessment.reset();
            assessment = assessmentRepository.save(assessment);
            log.info("Assessment restarted for {} (was {}, {} request(s) cancelled)", userId, previousStatus, cancelled);
            auditEventService.record("AssessmentRestarted", actorId, AuditEventService.fields(
                    "user", userId,
                    "previousStatus", previousStatus.name(),
                    "previousQuestionSetId", previousSet,
                    "cancelledRequests", cancelled));
            return toView(assessment);
        });
    }

    public boolean setOracleVerificationEnabled(String actor, boolean enabled) {
        return sequencer.execute(() -> {
            settingsService.requireOwner(actor);
            settingsService.update(settings -> settings.setOracleVerificationEnabled(enabled));
            log.info("Oracle verification {}", enabled ? "enabled" : "disabled");
            auditEventService.record("OracleVerificationToggled", Identities.normalize(actor),
                    AuditEventService.fields("enabled", enabled));
            return enabled;
        });
    }

    @Transactional(readOnly = true)
    public boolean isOracleVerificationEnabled() {
        return settingsService.isOracleVerificationEnabled();
    }

    @Transactional(readOnly = true)
    public Optional<AssessmentView> getAssessment(String user) {
        String userId = Identities.normalize(user);
        if (userId == null) {
            return Optional.empty();
        }
        return assessmentRepository.findById(userId).map(this::toView);
    }

    @Transactional(readOnly = true)
    public AssessmentStatusResponse getAssessmentStatus(String user) {
        String userId = Identities.require(user);
        AssessmentEntity assessment = assessmentRepository.findById(userId).orElse(null);
        if (assessment == null || assessment.getStatus() == AssessmentStatus.NOT_STARTED) {
            return new AssessmentStatusResponse(userId, false, null, AssessmentStatus.NOT_STARTED.name(), false, null, false);
        }
        boolean completed = assessment.getStatus() == AssessmentStatus.COMPLETED;
        Integer score = assessment.getScore();
        boolean passed = completed && score != null && rewardIssuer.isPassing(score);
        return new AssessmentStatusResponse(
                userId,
                true,
                assessment.getQuestionSetId(),
                assessment.getStatus().name(),
                completed,
                score,
                passed
        );
    }

    @Transactional(readOnly = true)
    public long countByStatus(AssessmentStatus status) {
        return assessmentRepository.countByStatus(status);
    }

    private String requireAnswersHash(String answersHash) {
        String hash = Hashes.require(answersHash, AssessmentError.INVALID_ANSWERS_HASH);
        if (Hashes.isZero(hash)) {
            throw new AssessmentException(AssessmentError.INVALID_ANSWERS_HASH);
        }
        return hash;
    }

    private AssessmentEntity applyAnswers(AssessmentEntity assessment, String answersHash) {
        switch (assessment.getStatus()) {
            case NOT_STARTED -> throw new AssessmentException(AssessmentError.NO_ACTIVE_ASSESSMENT);
            case ANSWERS_SUBMITTED, VERIFYING, COMPLETED ->
                    throw new AssessmentException(AssessmentError.ALREADY_SUBMITTED);
            case STARTED -> {
                // only STARTED accepts answers
            }
        }
        String hash = requireAnswersHash(answersHash);

        assessment.setAnswersHash(hash);
        assessment.setStatus(AssessmentStatus.ANSWERS_SUBMITTED);
        AssessmentEntity saved = assessmentRepository.save(assessment);
        log.info("Answers submitted for {}", saved.getUserId());
        auditEventService.record("AnswersSubmitted", saved.getUserId(), AuditEventService.fields(
                "user", saved.getUserId(),
                "questionSetId", saved.getQuestionSetId(),
                "answersHash", hash));
        return saved;
    }

    private AssessmentView toView(AssessmentEntity assessment) {
        return new AssessmentView(
                assessment.getUserId(),
                assessment.getQuestionSetId(),
                assessment.getAnswersHash(),
                assessment.getStatus().name(),
                assessment.getScore(),
                assessment.getResultHash(),
                assessment.getPendingRequestId(),
                Objects.toString(assessment.getRewardAmount(), null),
                assessment.getStartedAt(),
                assessment.getCompletedAt()
        );
    }
}
