package org.example.assessment.service;

import org.example.assessment.entity.OracleConfigEntity;
import org.example.assessment.entity.OracleRequestEntity;
import org.example.assessment.model.EvaluationResult;
import org.example.assessment.model.OracleConfigView;
import org.example.assessment.model.OracleRequestView;
import org.example.assessment.repository.OracleConfigRepository;
import org.example.assessment.repository.OracleRequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Lazy;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Bridges the synchronous workflow to the asynchronous scoring network. Owns the outstanding
 * request table and is the only path by which a scoring result reaches an assessment.
 */
@Service
public class EvaluationOracleService {

    private static final Logger log = LoggerFactory.getLogger(EvaluationOracleService.class);
    private static final int MAX_DON_ID_LENGTH = 66;

    private final OracleRequestRepository requestRepository;
    private final OracleConfigRepository configRepository;
    private final AuthorizationRegistryService authorizationRegistry;
    private final LedgerSettingsService settingsService;
    private final EvaluationNetwork evaluationNetwork;
    private final EvaluationResultDecoder resultDecoder;
    private final AssessmentService assessmentService;
    private final AuditEventService auditEventService;
    private final LedgerSequencer sequencer;

    public EvaluationOracleService(
            OracleRequestRepository requestRepository,
            OracleConfigRepository configRepository,
            AuthorizationRegistryService authorizationRegistry,
            LedgerSettingsService settingsService,
            EvaluationNetwork evaluationNetwork,
            EvaluationResultDecoder resultDecoder,
            @Lazy AssessmentService assessmentService,
            AuditEventService auditEventService,
            LedgerSequencer sequencer) {
        this.requestRepository = requestRepository;
        this.configRepository = configRepository;
        this.authorizationRegistry = authorizationRegistry;
        this.settingsService = settingsService;
        this.evaluationNetwork = evaluationNetwork;
        this.resultDecoder = resultDecoder;
        this.assessmentService = assessmentService;
        this.auditEventService = auditEventService;
        this.sequencer = sequencer;
    }

    /**
     * Sends an evaluation request to the scoring network and records it as outstanding.
     * Returns as soon as the network has accepted the request.
     */
    public String requestEvaluation(
            String caller,
            String user,
            String questionSetId,
            String answersHash,
            String contentHash) {
        return sequencer.execute(() -> {
            if (!authorizationRegistry.isAuthorized(caller)) {
                throw new AssessmentException(AssessmentError.CALLER_NOT_AUTHORIZED);
            }
            OracleConfigEntity config = currentConfig();
            if (config.getEvaluationSource() == null || config.getEvaluationSource().isBlank()) {
                throw new AssessmentException(AssessmentError.SOURCE_NOT_CONFIGURED);
            }
            if (config.getSubscriptionId() == 0) {
                throw new AssessmentException(AssessmentError.SUBSCRIPTION_NOT_CONFIGURED);
            }
            String userId = Identities.require(user);

            EvaluationRequest request = new EvaluationRequest(
                    config.getSubscriptionId(),
                    config.getEncryptedSecrets(),
                    config.getDonId(),
                    config.getEvaluationSource(),
                    List.of(questionSetId, answersHash, contentHash));
            String requestId = evaluationNetwork.sendRequest(request);
            if (!Hashes.isWellFormed(requestId)) {
                throw new IllegalStateException("Evaluation network returned a malformed request id: " + requestId);
            }
            if (requestRepository.existsById(requestId)) {
                throw new AssessmentException(AssessmentError.DUPLICATE_REQUEST, "Request id already outstanding: " + requestId);
            }

            requestRepository.save(new OracleRequestEntity(requestId, userId, questionSetId));
            log.info("Evaluation requested for {} on set {}: requestId={}", userId, questionSetId, requestId);
            auditEventService.record("EvaluationRequested", Identities.normalize(caller), AuditEventService.fields(
                    "requestId", requestId,
                    "user", userId,
                    "questionSetId", questionSetId,
                    "network", evaluationNetwork.getNetworkName()));
            return requestId;
        });
    }

    /**
     * Consumes the outstanding request and completes the user's assessment. Malformed payloads
     * complete with score 0 and the zero hash. Unknown or already consumed ids are rejected
     * without changing any assessment or request state.
     */
    public EvaluationResult onEvaluationCallback(String requestId, byte[] rawResult) {
        Optional<EvaluationResult> applied = sequencer.execute(() -> fulfil(requestId, rawResult));
        return applied.orElseThrow(() -> new AssessmentException(
                AssessmentError.UNKNOWN_REQUEST, "Unknown request: " + requestId));
    }

    @EventListener
    public void onEvaluationFulfilled(EvaluationFulfilledEvent event) {
        try {
            onEvaluationCallback(event.requestId(), event.rawResult());
        } catch (AssessmentException e) {
            log.warn("Evaluation callback {} rejected: {}", event.requestId(), e.getMessage());
        }
    }

    /**
     * Owner override: completes an assessment with a directly supplied result. Any outstanding
     * request for the user is cancelled.
     */
    public EvaluationResult submitManualResult(String actor, String user, String resultHash, long score) {
        return sequencer.execute(() -> {
            settingsService.requireOwner(actor);
            String userId = Identities.require(user);
            String hash = Hashes.require(resultHash, AssessmentError.INVALID_RESULT_HASH);
            EvaluationResult result = new EvaluationResult(EvaluationResultDecoder.clampScore(score), hash);

            cancelOutstandingRequests(userId, "manual-result");
            auditEventService.record("ManualResultSubmitted", Identities.normalize(actor), AuditEventService.fields(
                    "user", userId,
                    "score", result.score(),
                    "resultHash", hash));
            assessmentService.onVerificationComplete(userId, result.score(), hash, null);
            return result;
        });
    }

    /**
     * Decodes a payload exactly as a callback would, without touching any state.
     */
    public EvaluationResult testEvaluation(String rawResult) {
        return resultDecoder.decode(rawResult);
    }

    public OracleConfigView updateConfig(String actor, long subscriptionId, byte[] encryptedSecrets, String donId) {
        sequencer.run(() -> {
            settingsService.requireOwner(actor);
            if (subscriptionId < 0) {
                throw new IllegalArgumentException("subscriptionId must not be negative");
            }
            String normalizedDonId = donId == null ? null : donId.trim();
            if (normalizedDonId != null && normalizedDonId.length() > MAX_DON_ID_LENGTH) {
                throw new IllegalArgumentException("donId must be at most " + MAX_DON_ID_LENGTH + " characters");
            }
            OracleConfigEntity config = currentConfig();
            config.setSubscriptionId(subscriptionId);
            config.setEncryptedSecrets(encryptedSecrets == null ? new byte[0] : encryptedSecrets);
            config.setDonId(normalizedDonId);
            configRepository.save(config);
            log.info("Oracle config updated: subscriptionId={}, donId={}", subscriptionId, normalizedDonId);
            auditEventService.record("ConfigUpdated", Identities.normalize(actor), AuditEventService.fields(
                    "subscriptionId", subscriptionId,
                    "secretsHash", Hashes.sha256(config.getEncryptedSecrets()),
                    "donId", normalizedDonId));
        });
        return getConfig();
    }

    public OracleConfigView updateEvaluationSource(String actor, String sourceCode) {
        sequencer.run(() -> {
            settingsService.requireOwner(actor);
            OracleConfigEntity config = currentConfig();
            config.setEvaluationSource(sourceCode == null || sourceCode.isBlank() ? null : sourceCode);
            configRepository.save(config);
            log.info("Evaluation source updated ({} chars)", sourceCode == null ? 0 : sourceCode.length());
            auditEventService.record("SourceCodeUpdated", Identities.normalize(actor), AuditEventService.fields(
                    "sourceHash", config.getEvaluationSource() == null
                            ? Hashes.ZERO
                            : Hashes.sha256(config.getEvaluationSource())));
        });
        return getConfig();
    }

    @Transactional(readOnly = true)
    public OracleConfigView getConfig() {
        return toView(currentConfig());
    }

    @Transactional(readOnly = true)
    public Optional<OracleRequestView> getOutstandingRequest(String requestId) {
        String id = normalizeRequestId(requestId);
        if (id == null) {
            return Optional.empty();
        }
        return requestRepository.findById(id).map(this::toView);
    }

    @Transactional(readOnly = true)
    public long outstandingRequestCount() {
        return requestRepository.count();
    }

    /**
     * Drops every outstanding request for the user so late callbacks are rejected.
     *
     * @return the number of requests cancelled
     */
    public int cancelOutstandingRequests(String userId, String reason) {
        List<OracleRequestEntity> outstanding = requestRepository.findByUserId(userId);
        for (OracleRequestEntity request : outstanding) {
            requestRepository.delete(request);
            log.info("Cancelled outstanding request {} for {} ({})", request.getRequestId(), userId, reason);
            auditEventService.record("VerificationCancelled", null, AuditEventService.fields(
                    "requestId", request.getRequestId(),
                    "user", userId,
                    "reason", reason));
        }
        return outstanding.size();
    }

    private Optional<EvaluationResult> fulfil(String requestId, byte[] rawResult) {
        String id = normalizeRequestId(requestId);
        Optional<OracleRequestEntity> outstanding = id == null ? Optional.empty() : requestRepository.findById(id);
        if (outstanding.isEmpty()) {
            log.warn("Rejected callback for unknown request {}", requestId);
            auditEventService.record("CallbackRejected", null, AuditEventService.fields(
                    "requestId", requestId,
                    "reason", "unknown-request"));
            return Optional.empty();
        }

        OracleRequestEntity request = outstanding.get();
        EvaluationResult result;
        boolean malformed = false;
        try {
            result = resultDecoder.decode(rawResult);
        } catch (AssessmentException e) {
            log.error("Malformed evaluation result for request {}: {}", id, e.getMessage());
            result = new EvaluationResult(0, Hashes.ZERO);
            malformed = true;
        }

        requestRepository.delete(request);
        auditEventService.record("EvaluationFulfilled", null, AuditEventService.fields(
                "requestId", id,
                "user", request.getUserId(),
                "score", result.score(),
                "resultHash", result.resultHash(),
                "malformed", malformed));
        assessmentService.onVerificationComplete(request.getUserId(), result.score(), result.resultHash(), id);
        return Optional.of(result);
    }

    private OracleConfigEntity currentConfig() {
        return configRepository.findById(OracleConfigEntity.GLOBAL_ID).orElseGet(() -> {
            OracleConfigEntity config = new OracleConfigEntity();
            config.setId(OracleConfigEntity.GLOBAL_ID);
            return config;
        });
    }

    private String normalizeRequestId(String requestId) {
        if (requestId == null) {
            return null;
        }
        String id = requestId.trim().toLowerCase(Locale.ROOT);
        return Hashes.isWellFormed(id) ? id : null;
    }

    private OracleConfigView toView(OracleConfigEntity config) {
        byte[] secrets = config.getEncryptedSecrets();
        String source = config.getEvaluationSource();
        return new OracleConfigView(
                config.getSubscriptionId(),
                config.getDonId(),
                secrets != null && secrets.length > 0,
                source,
                source != null && !source.isBlank(),
                evaluationNetwork.getNetworkName(),
                evaluationNetwork.isAvailable(),
                requestRepository.count()
        );
    }

    private OracleRequestView toView(OracleRequestEntity request) {
        return new OracleRequestView(
                request.getRequestId(),
                request.getUserId(),
                request.getQuestionSetId(),
                request.getIssuedAt()
        );
    }
}
