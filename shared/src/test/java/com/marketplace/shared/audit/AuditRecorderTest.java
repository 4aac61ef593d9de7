package com.marketplace.shared.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketplace.shared.workflow.EntityKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuditRecorderTest {

    @Mock AuditRecordRepository repository;

    AuditRecorder recorder;

    @BeforeEach
    void setUp() {
        recorder = new AuditRecorder(repository, new ObjectMapper());
    }

    @Test
    @DisplayName("record stores serialized before/after state and returns the new id")
    void recordPersists() {
        AuditEntry entry = new AuditEntry("rev_1", AuditActions.LISTING_STATUS_UPDATE, EntityKind.LISTING,
                "lst_1", Map.of("status", "PENDING_REVIEW"), Map.of("status", "REJECTED", "reason", "blurry"));

        String id = recorder.record(entry);

        ArgumentCaptor<AuditRecord> captor = ArgumentCaptor.forClass(AuditRecord.class);
        verify(repository).save(captor.capture());
        AuditRecord saved = captor.getValue();
        assertThat(saved.getId()).isEqualTo(id);
        assertThat(saved.getActorId()).isEqualTo("rev_1");
        assertThat(saved.getBeforeState()).isEqualTo("{\"status\":\"PENDING_REVIEW\"}");
        assertThat(saved.getAfterState()).contains("\"reason\":\"blurry\"");
        assertThat(saved.getCreatedAt()).isNotNull();
        assertThat(saved.getOccurredAt()).isEqualTo(entry.occurredAt());
    }

    @Test
    @DisplayName("a late write keeps the time of the change, so replays sort where the change happened")
    void lateWriteKeepsChangeTime() {
        Instant approvedAt = Instant.parse("2026-03-01T10:00:00Z");
        AuditEntry replayed = new AuditEntry("rev_1", AuditActions.LISTING_STATUS_UPDATE, EntityKind.LISTING,
                "lst_1", Map.of("status", "PENDING_REVIEW"), Map.of("status", "APPROVED"), approvedAt);

        recorder.record(replayed);

        ArgumentCaptor<AuditRecord> captor = ArgumentCaptor.forClass(AuditRecord.class);
        verify(repository).save(captor.capture());
        assertThat(captor.getValue().getOccurredAt()).isEqualTo(approvedAt);
        assertThat(captor.getValue().getCreatedAt()).isAfter(approvedAt);
    }

    @Test
    @DisplayName("an entry without a change time is stamped at write time")
    void missingChangeTime() {
        recorder.record(new AuditEntry("a", "X", EntityKind.ORDER, "o", null, null, null));

        verify(repository).save(argThat(r -> r.getOccurredAt() != null && r.getOccurredAt().equals(r.getCreatedAt())));
    }

    @Test
    @DisplayName("creation records have no before state")
    void nullBeforeState() {
        recorder.record(new AuditEntry("sel_1", AuditActions.LISTING_CREATED, EntityKind.LISTING,
                "lst_1", null, Map.of("status", "DRAFT")));

        verify(repository).save(argThat(r -> r.getBeforeState() == null));
    }

    @Test
    @DisplayName("store outage surfaces as AuditUnavailableException")
    void storeOutage() {
        when(repository.save(any())).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatThrownBy(() -> recorder.record(new AuditEntry("a", "X", EntityKind.ORDER, "o", null, null)))
                .isInstanceOf(AuditRecorder.AuditUnavailableException.class);
    }

    @Test
    @DisplayName("moderation lookup only considers decision actions")
    void latestModerationDecision() {
        AuditRecord decision = AuditRecord.builder().id("r1").action(AuditActions.LISTING_STATUS_UPDATE).build();
        when(repository.findFirstByEntityIdAndActionInOrderByOccurredAtDesc("lst_1", AuditActions.MODERATION_DECISIONS))
                .thenReturn(Optional.of(decision));

        assertThat(recorder.latestModerationDecision("lst_1")).contains(decision);
    }
}
