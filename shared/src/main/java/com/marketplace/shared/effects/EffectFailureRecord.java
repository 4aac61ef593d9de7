package com.marketplace.shared.effects;

import com.marketplace.shared.workflow.EntityKind;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * A post-commit effect that failed, kept so the reconciliation relay can replay it.
 * The committed state change itself is never touched.
 */
@Entity
@Table(name = "effect_failures", indexes = {
    @Index(name = "idx_effect_failures_due", columnList = "resolved_at, retry_count, next_retry_at"),
    @Index(name = "idx_effect_failures_entity", columnList = "entity_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EffectFailureRecord {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_kind", nullable = false, length = 20)
    private EntityKind entityKind;

    @Column(name = "entity_id", nullable = false, length = 50)
    private String entityId;

    @Enumerated(EnumType.STRING)
    @Column(name = "effect", nullable = false, length = 20)
    private EffectStep effect;

    /** What the step tried to do, as JSON. */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload", columnDefinition = "jsonb")
    private String payload;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    @Column(name = "retry_count", nullable = false)
    @Builder.Default
    private int retryCount = 0;

    @Column(name = "next_retry_at")
    private Instant nextRetryAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onPrePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    void onPreUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isResolved() {
        return resolvedAt != null;
    }

    public boolean isExhausted(int maxAttempts) {
        return retryCount >= maxAttempts;
    }

    public void markResolved() {
        this.resolvedAt = Instant.now();
    }

    /** Backoff: 5s, 10s, 20s, 40s, 80s */
    public void recordFailure(String errorMessage) {
        this.retryCount++;
        this.lastError = errorMessage;
        long backoffSeconds = (long) Math.pow(2, retryCount - 1) * 5L;
        this.nextRetryAt = Instant.now().plusSeconds(backoffSeconds);
    }
}
