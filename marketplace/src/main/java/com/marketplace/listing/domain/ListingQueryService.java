package com.marketplace.listing.domain;

import com.marketplace.shared.audit.AuditRecord;
import com.marketplace.shared.audit.AuditRecorder;
import com.marketplace.shared.cache.CacheSynchronizer;
import com.marketplace.shared.workflow.ListingStatus;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Listing Query Service — read side: single listings, the moderation dashboard count
 * and the audit trail behind a listing's current state.
 */
@Service
public class ListingQueryService {

    private final ListingStore store;
    private final CacheSynchronizer cache;
    private final AuditRecorder auditRecorder;
    private final long pendingCountTtlSeconds;

    public ListingQueryService(ListingStore store,
                               CacheSynchronizer cache,
                               AuditRecorder auditRecorder,
                               @Value("${workflow.pending-count-ttl-seconds:15}") long pendingCountTtlSeconds) {
        this.store = store;
        this.cache = cache;
        this.auditRecorder = auditRecorder;
        this.pendingCountTtlSeconds = pendingCountTtlSeconds;
    }

    public Listing getListing(String listingId) {
        return store.findById(listingId)
                .orElseThrow(() -> new ListingWorkflowService.ListingNotFoundException(listingId));
    }

    /** Served from Redis when available, recomputed from the store otherwise. */
    public long pendingReviewCount() {
        return cache.getOrComputeCount(ListingWorkflowService.PENDING_COUNT_KEY, pendingCountTtlSeconds,
                () -> store.countByStatus(ListingStatus.PENDING_REVIEW));
    }

    /** Latest reviewer decision or auto-approval, for showing the owner why. */
    public Optional<AuditRecord> moderationDecision(String listingId) {
        getListing(listingId);
        return auditRecorder.latestModerationDecision(listingId);
    }

    public List<AuditRecord> history(String listingId) {
        return auditRecorder.history(listingId);
    }
}
