package com.marketplace.shared.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Appends before/after records for every state change and answers "who put this entity in its
 * current state, and why".
 *
 * Only durable-store unavailability fails a write; callers treat that as a side-effect failure.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditRecorder {

    private final AuditRecordRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * @return id of the appended record
     * @throws AuditUnavailableException if the store cannot be written
     */
    public String record(AuditEntry entry) {
        Instant now = Instant.now();
        AuditRecord record = AuditRecord.builder()
                .id(UUID.randomUUID().toString())
                .entityKind(entry.entityKind())
                .entityId(entry.entityId())
                .actorId(entry.actorId())
                .action(entry.action())
                .beforeState(toJson(entry.before()))
                .afterState(toJson(entry.after()))
                .occurredAt(entry.occurredAt() != null ? entry.occurredAt() : now)
                .createdAt(now)
                .build();
        try {
            repository.save(record);
        } catch (DataAccessException e) {
            throw new AuditUnavailableException("Audit store unavailable for " + entry.entityId(), e);
        }
        log.debug("Audit recorded: id={}, entityId={}, action={}, actorId={}",
                record.getId(), entry.entityId(), entry.action(), entry.actorId());
        return record.getId();
    }

    /** Most recent change first. */
    public List<AuditRecord> history(String entityId) {
        return repository.findByEntityIdOrderByOccurredAtDesc(entityId);
    }

    /**
     * Latest moderation outcome for a listing, reviewer decision or auto-approval,
     * whichever came last.
     */
    public Optional<AuditRecord> latestModerationDecision(String listingId) {
        return repository.findFirstByEntityIdAndActionInOrderByOccurredAtDesc(
                listingId, AuditActions.MODERATION_DECISIONS);
    }

    private String toJson(Map<String, Object> state) {
        if (state == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize audit state", e);
        }
    }

    public static class AuditUnavailableException extends RuntimeException {
        public AuditUnavailableException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
