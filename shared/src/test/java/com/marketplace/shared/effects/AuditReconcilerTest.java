package com.marketplace.shared.effects;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.marketplace.shared.audit.AuditActions;
import com.marketplace.shared.audit.AuditEntry;
import com.marketplace.shared.audit.AuditRecorder;
import com.marketplace.shared.workflow.EntityKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AuditReconcilerTest {

    @Mock AuditRecorder auditRecorder;

    ObjectMapper objectMapper;
    AuditReconciler reconciler;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        reconciler = new AuditReconciler(auditRecorder, objectMapper);
    }

    @Test
    @DisplayName("replayed approval keeps its original time and sorts before a later rejection")
    void replayKeepsOriginalOrder() throws Exception {
        AuditEntry approval = new AuditEntry("rev_1", AuditActions.LISTING_STATUS_UPDATE, EntityKind.LISTING,
                "lst_1", Map.of("status", "PENDING_REVIEW"), Map.of("status", "APPROVED"),
                Instant.parse("2026-03-01T10:00:00Z"));
        AuditEntry laterRejection = new AuditEntry("rev_1", AuditActions.LISTING_STATUS_UPDATE, EntityKind.LISTING,
                "lst_1", Map.of("status", "PENDING_REVIEW"), Map.of("status", "REJECTED"),
                Instant.parse("2026-03-01T10:05:00Z"));
        EffectFailureRecord failure = EffectFailureRecord.builder()
                .id("eff_1")
                .entityKind(EntityKind.LISTING)
                .entityId("lst_1")
                .effect(EffectStep.AUDIT)
                .payload(objectMapper.writeValueAsString(approval))
                .build();

        reconciler.reconcile(failure);

        ArgumentCaptor<AuditEntry> replayed = ArgumentCaptor.forClass(AuditEntry.class);
        verify(auditRecorder).record(replayed.capture());
        assertThat(replayed.getValue()).isEqualTo(approval);
        assertThat(replayed.getValue().occurredAt()).isBefore(laterRejection.occurredAt());
    }
}
