package com.marketplace.shared.effects;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketplace.shared.workflow.EntityKind;
import jakarta.persistence.LockModeType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

interface EffectFailureRepository extends JpaRepository<EffectFailureRecord, String> {

    /**
     * Unresolved failures whose backoff has elapsed. SKIP LOCKED lets several relay instances
     * share the table without blocking each other.
     */
    @Query(value = """
        SELECT * FROM effect_failures
        WHERE resolved_at IS NULL
          AND retry_count < :maxAttempts
          AND (next_retry_at IS NULL OR next_retry_at <= :now)
        ORDER BY created_at ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    List<EffectFailureRecord> findDue(@Param("now") Instant now,
                                      @Param("maxAttempts") int maxAttempts,
                                      @Param("limit") int limit);
}

/**
 * Writes failed side effects to the effect_failures table.
 *
 * Best effort like the effects themselves: if the ledger is also unreachable the failure is
 * only logged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EffectFailureLedger {

    private final EffectFailureRepository repository;
    private final ObjectMapper objectMapper;

    public void record(EntityKind kind, String entityId, EffectStep step, Object payload, Throwable error) {
        try {
            EffectFailureRecord record = EffectFailureRecord.builder()
                    .id(UUID.randomUUID().toString())
                    .entityKind(kind)
                    .entityId(entityId)
                    .effect(step)
                    .payload(objectMapper.writeValueAsString(payload))
                    .lastError(String.valueOf(error.getMessage()))
                    .build();
            repository.save(record);
        } catch (Exception e) {
            log.error("Could not record effect failure, reconciliation will miss it: entityKind={}, entityId={}, effect={}, payload={}",
                    kind, entityId, step, payload, e);
        }
    }
}
