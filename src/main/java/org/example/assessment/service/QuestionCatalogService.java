package org.example.assessment.service;

import org.example.assessment.entity.QuestionSetEntity;
import org.example.assessment.model.QuestionSetMetadata;
import org.example.assessment.repository.QuestionSetRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Catalog of question sets. Set ids are immutable once submitted and sets are never deleted,
 * only deactivated.
 */
@Service
public class QuestionCatalogService {

    private static final Logger log = LoggerFactory.getLogger(QuestionCatalogService.class);
    private static final int MAX_SET_ID_LENGTH = 128;

    private final QuestionSetRepository questionSetRepository;
    private final LedgerSettingsService settingsService;
    private final AuditEventService auditEventService;
    private final LedgerSequencer sequencer;

    public QuestionCatalogService(
            QuestionSetRepository questionSetRepository,
            LedgerSettingsService settingsService,
            AuditEventService auditEventService,
            LedgerSequencer sequencer) {
        this.questionSetRepository = questionSetRepository;
        this.settingsService = settingsService;
        this.auditEventService = auditEventService;
        this.sequencer = sequencer;
    }

    public QuestionSetMetadata submitQuestionSet(String actor, String setId, String contentHash, int questionCount) {
        return sequencer.execute(() -> {
            settingsService.requireOwner(actor);
            String id = normalizeSetId(setId);
            String hash = Hashes.require(contentHash, AssessmentError.INVALID_CONTENT_HASH);
            if (Hashes.isZero(hash)) {
                throw new AssessmentException(AssessmentError.INVALID_CONTENT_HASH, "Content hash must be non-zero");
            }
            if (questionCount <= 0) {
                throw new AssessmentException(AssessmentError.INVALID_QUESTION_COUNT);
            }
            if (questionSetRepository.existsById(id)) {
                throw new AssessmentException(AssessmentError.DUPLICATE_ID, "Question set already exists: " + id);
            }

            QuestionSetEntity entity = questionSetRepository.save(
                    new QuestionSetEntity(id, hash, questionCount, questionSetRepository.count()));
            log.info("Question set {} submitted with {} questions", id, questionCount);
            auditEventService.record("QuestionSetSubmitted", Identities.normalize(actor), AuditEventService.fields(
                    "questionSetId", id,
                    "contentHash", hash,
                    "questionCount", questionCount));
            return toMetadata(entity);
        });
    }

    public QuestionSetMetadata activate(String actor, String setId) {
        return setActive(actor, setId, true);
    }

    public QuestionSetMetadata deactivate(String actor, String setId) {
        return setActive(actor, setId, false);
    }

    /**
     * All set ids in submission order.
     */
    @Transactional(readOnly = true)
    public List<String> list() {
        return questionSetRepository.findAllByOrderByCatalogIndexAsc().stream()
                .map(QuestionSetEntity::getSetId)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<String> listActive() {
        return questionSetRepository.findAllByOrderByCatalogIndexAsc().stream()
                .filter(QuestionSetEntity::isActive)
                .map(QuestionSetEntity::getSetId)
                .toList();
    }

    @Transactional(readOnly = true)
    public QuestionSetMetadata getQuestionSetMetadata(String setId) {
        return toMetadata(requireQuestionSet(setId));
    }

    @Transactional(readOnly = true)
    public long questionSetCount() {
        return questionSetRepository.count();
    }

    public Optional<QuestionSetEntity> findQuestionSet(String setId) {
        String id = setId == null ? null : setId.trim();
        if (id == null || id.isEmpty()) {
            return Optional.empty();
        }
        return questionSetRepository.findById(id);
    }

    public QuestionSetEntity requireQuestionSet(String setId) {
        return findQuestionSet(setId)
                .orElseThrow(() -> new AssessmentException(
                        AssessmentError.SET_NOT_FOUND, "Question set does not exist: " + setId));
    }

    private QuestionSetMetadata setActive(String actor, String setId, boolean active) {
        return sequencer.execute(() -> {
            settingsService.requireOwner(actor);
            QuestionSetEntity entity = requireQuestionSet(setId);
            if (entity.isActive() != active) {
                entity.setActive(active);
                entity = questionSetRepository.save(entity);
                log.info("Question set {} {}", entity.getSetId(), active ? "activated" : "deactivated");
            } else {
                log.debug("Question set {} already {}", entity.getSetId(), active ? "active" : "inactive");
            }
            auditEventService.record(
                    active ? "QuestionSetActivated" : "QuestionSetDeactivated",
                    Identities.normalize(actor),
                    AuditEventService.fields("questionSetId", entity.getSetId()));
            return toMetadata(entity);
        });
    }

    private String normalizeSetId(String setId) {
        String id = setId == null ? "" : setId.trim();
        if (id.isEmpty() || id.length() > MAX_SET_ID_LENGTH) {
            throw new AssessmentException(AssessmentError.INVALID_QUESTION_SET_ID, "Question set id is invalid: " + setId);
        }
        return id;
    }

    private QuestionSetMetadata toMetadata(QuestionSetEntity entity) {
        return new QuestionSetMetadata(
                entity.getSetId(),
                entity.getContentHash(),
                entity.getQuestionCount(),
                entity.isActive(),
                entity.getSubmittedAt()
        );
    }
}
