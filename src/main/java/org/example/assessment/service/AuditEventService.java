package org.example.assessment.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.assessment.config.RequestCorrelation;
import org.example.assessment.entity.AuditEventEntity;
import org.example.assessment.model.AuditChainStatus;
import org.example.assessment.model.AuditEvent;
import org.example.assessment.repository.AuditEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only record of every ledger mutation. Entries are chained by SHA-256 so that any
 * edit or deletion of a stored row is detectable with {@link #verifyChain()}.
 */
@Service
public class AuditEventService {

    private static final Logger log = LoggerFactory.getLogger(AuditEventService.class);
    private static final int MAX_RECENT = 500;

    private final AuditEventRepository auditEventRepository;
    private final ObjectMapper objectMapper;

    public AuditEventService(AuditEventRepository auditEventRepository, ObjectMapper objectMapper) {
        this.auditEventRepository = auditEventRepository;
        this.objectMapper = objectMapper;
    }

    /**
     * Builds an ordered attribute map from alternating keys and values, skipping null values.
     */
    public static Map<String, Object> fields(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Audit fields must be key/value pairs");
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            Object value = keyValues[i + 1];
            if (value != null) {
                fields.put(String.valueOf(keyValues[i]), value);
            }
        }
        return fields;
    }

    public AuditEvent record(String eventType, String actor, Map<String, Object> attributes) {
        Map<String, Object> event = buildEvent(eventType, actor, attributes);
        log.info("ledger_audit {}", event);

        String payloadJson = toJson(attributes);
        String previousHash = auditEventRepository.findTopByOrderBySequenceDesc()
                .map(AuditEventEntity::getEntryHash)
                .orElse(Hashes.ZERO);

        AuditEventEntity entity = new AuditEventEntity();
        entity.setEventType(eventType);
        entity.setActor(actor);
        entity.setPayloadJson(payloadJson);
        entity.setPreviousHash(previousHash);
        // Truncated so the hashed value is the one the column stores.
        LocalDateTime recordedAt = LocalDateTime.now().truncatedTo(ChronoUnit.MILLIS);
        entity.setRecordedAt(recordedAt);
        entity.setEntryHash(chainHash(previousHash, eventType, actor, payloadJson, recordedAt));
        return toModel(auditEventRepository.save(entity));
    }

    @Transactional(readOnly = true)
    public List<AuditEvent> recentEvents(int limit) {
        int pageSize = Math.max(1, Math.min(limit, MAX_RECENT));
        return auditEventRepository.findRecent(PageRequest.of(0, pageSize)).stream()
                .map(this::toModel)
                .toList();
    }

    @Transactional(readOnly = true)
    public AuditChainStatus verifyChain() {
        List<AuditEventEntity> events = auditEventRepository.findAllByOrderBySequenceAsc();
        String expectedPrevious = Hashes.ZERO;
        for (AuditEventEntity event : events) {
            String expectedEntry = chainHash(event.getPreviousHash(), event.getEventType(), event.getActor(),
                    event.getPayloadJson(), event.getRecordedAt());
            if (!expectedPrevious.equals(event.getPreviousHash()) || !expectedEntry.equals(event.getEntryHash())) {
                log.warn("Audit chain broken at sequence {}", event.getSequence());
                return new AuditChainStatus(false, events.size(), event.getSequence());
            }
            expectedPrevious = event.getEntryHash();
        }
        return new AuditChainStatus(true, events.size(), null);
    }

    Map<String, Object> buildEvent(String eventType, String actor, Map<String, Object> attributes) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("event", eventType);
        event.put("actor", actor == null ? "system" : actor);
        RequestCorrelation.current().ifPresent(requestId -> event.put("requestId", requestId));
        if (attributes != null) {
            event.putAll(attributes);
        }
        return event;
    }

    static String chainHash(
            String previousHash, String eventType, String actor, String payloadJson, LocalDateTime recordedAt) {
        String timestamp = recordedAt == null ? "" : recordedAt.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        return Hashes.sha256(previousHash + "|" + eventType + "|" + actor + "|" + payloadJson + "|" + timestamp);
    }

    private String toJson(Map<String, Object> attributes) {
        try {
            return objectMapper.writeValueAsString(attributes == null ? Map.of() : attributes);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit payload", e);
        }
    }

    private AuditEvent toModel(AuditEventEntity entity) {
        return new AuditEvent(
                entity.getSequence() == null ? 0L : entity.getSequence(),
                entity.getEventType(),
                entity.getActor(),
                entity.getPayloadJson(),
                entity.getPreviousHash(),
                entity.getEntryHash(),
                entity.getRecordedAt()
        );
    }
}
