package com.marketplace.shared.audit;

import com.marketplace.shared.workflow.EntityKind;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * Append-only audit trail row: who moved which entity from what to what, and when.
 * No setters; rows are never updated.
 */
@Entity
@Table(name = "audit_records", indexes = {
    @Index(name = "idx_audit_entity", columnList = "entity_id, occurred_at"),
    @Index(name = "idx_audit_action", columnList = "action")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditRecord {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_kind", nullable = false, length = 20)
    private EntityKind entityKind;

    @Column(name = "entity_id", nullable = false, length = 50)
    private String entityId;

    @Column(name = "actor_id", nullable = false, length = 50)
    private String actorId;

    @Column(name = "action", nullable = false, length = 50)
    private String action;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "before_state", columnDefinition = "jsonb")
    private String beforeState;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "after_state", columnDefinition = "jsonb")
    private String afterState;

    /** When the state change happened. */
    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    /** When this row was written; later than occurredAt for replayed entries. */
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
