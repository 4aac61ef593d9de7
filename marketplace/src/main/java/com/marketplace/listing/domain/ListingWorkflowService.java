package com.marketplace.listing.domain;

import com.marketplace.listing.search.SearchSynchronizer;
import com.marketplace.shared.audit.AuditActions;
import com.marketplace.shared.audit.AuditEntry;
import com.marketplace.shared.effects.EffectPlan;
import com.marketplace.shared.effects.Notification;
import com.marketplace.shared.effects.SideEffectOrchestrator;
import com.marketplace.shared.events.EventTypes;
import com.marketplace.shared.fanout.ChannelNames;
import com.marketplace.shared.locking.EntityLocks;
import com.marketplace.shared.workflow.*;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

/**
 * Listing Workflow Service — write side for listings.
 *
 * Every operation follows the same path:
 *   lock the listing → read → validate → write (version checked, committed) → dispatch effects
 *
 * Effects (audit, pending-count invalidation, search sync, fan-out) are dispatched after the
 * write and never fail the call. The featured flag is the exception: it is cleared inside the
 * write itself so the stored listing never violates the low-stock rule.
 */
@Slf4j
@Service
public class ListingWorkflowService {

    public static final String PENDING_COUNT_KEY = "listings:pending:count";

    private static final int MAX_OPTIMISTIC_RETRIES = 3;

    private final ListingStore store;
    private final TransitionValidator validator;
    private final AutoDecisionEngine autoDecisionEngine;
    private final SearchSynchronizer searchSynchronizer;
    private final SideEffectOrchestrator orchestrator;
    private final EntityLocks locks;
    private final MeterRegistry meterRegistry;
    private final int lowStockThreshold;

    public ListingWorkflowService(ListingStore store,
                                  TransitionValidator validator,
                                  AutoDecisionEngine autoDecisionEngine,
                                  SearchSynchronizer searchSynchronizer,
                                  SideEffectOrchestrator orchestrator,
                                  EntityLocks locks,
                                  MeterRegistry meterRegistry,
                                  @Value("${workflow.low-stock-threshold:5}") int lowStockThreshold) {
        this.store = store;
        this.validator = validator;
        this.autoDecisionEngine = autoDecisionEngine;
        this.searchSynchronizer = searchSynchronizer;
        this.orchestrator = orchestrator;
        this.locks = locks;
        this.meterRegistry = meterRegistry;
        this.lowStockThreshold = lowStockThreshold;
    }

    // ─── Creation ─────────────────────────────────────────────────────────────

    /**
     * Create a listing. A saved draft stays in DRAFT. A submitted listing is auto-approved when
     * the auto-decision allows it, otherwise it waits in PENDING_REVIEW.
     */
    public Listing create(ListingDraft draft, String ownerId, boolean ownerTrusted, boolean submit) {
        boolean autoApprove = submit && autoDecisionEngine.decide(draft, ownerTrusted).autoApprove();
        ListingStatus initial = !submit ? ListingStatus.DRAFT
                : autoApprove ? ListingStatus.APPROVED : ListingStatus.PENDING_REVIEW;

        Listing listing = Listing.builder()
                .id("lst_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12))
                .ownerId(ownerId)
                .name(draft.getName())
                .description(draft.getDescription())
                .price(draft.getPrice())
                .unit(draft.getUnit())
                .stockQty(draft.getStockQty())
                .minOrderQty(draft.getMinOrderQty())
                .categoryId(draft.getCategoryId())
                .images(new ArrayList<>(draft.getImages()))
                .featured(false)
                .status(initial)
                .build();

        Listing saved = store.create(listing);
        countTransition("created", initial.name());

        EffectPlan.EffectPlanBuilder plan = EffectPlan.builder()
                .entityKind(EntityKind.LISTING)
                .entityId(saved.getId())
                .audit(autoApprove
                        ? new AuditEntry(ActorRole.SYSTEM.name(), AuditActions.LISTING_AUTO_APPROVE,
                                EntityKind.LISTING, saved.getId(), null, saved.auditState())
                        : new AuditEntry(ownerId, AuditActions.LISTING_CREATED,
                                EntityKind.LISTING, saved.getId(), null, saved.auditState()));

        if (initial == ListingStatus.PENDING_REVIEW) {
            plan.invalidation(PENDING_COUNT_KEY)
                .notification(new Notification(ChannelNames.REVIEWERS, EventTypes.LISTING_NEW, statusPayload(saved)));
        }
        if (autoApprove) {
            plan.search(() -> searchSynchronizer.sync(saved))
                .notification(new Notification(ChannelNames.owner(ownerId), EventTypes.LISTING_STATUS, statusPayload(saved)));
        }
        orchestrator.dispatch(plan.build());

        log.info("Listing created: listingId={}, ownerId={}, status={}, autoApproved={}",
                saved.getId(), ownerId, initial, autoApprove);
        return saved;
    }

    // ─── Transitions ──────────────────────────────────────────────────────────

    /** DRAFT → PENDING_REVIEW by the owner. */
    public Listing publish(String listingId, String actorId, ActorRole role) {
        return change(listingId, actorId, role, current -> ListingStatus.PENDING_REVIEW,
                AuditActions.LISTING_PUBLISH, null, null);
    }

    /**
     * Owner edit. A DRAFT only has its content changed; any other state goes (back) to
     * PENDING_REVIEW, because an approval covers the content that was reviewed.
     */
    public Listing edit(String listingId, ListingEdit edit, String actorId, ActorRole role) {
        return change(listingId, actorId, role,
                current -> current == ListingStatus.DRAFT ? ListingStatus.DRAFT : ListingStatus.PENDING_REVIEW,
                null, null, edit);
    }

    /** Reviewer decision on a PENDING_REVIEW listing. */
    public Listing review(String listingId, ListingStatus decision, String reason, String reviewerId, ActorRole role) {
        if (decision != ListingStatus.APPROVED && decision != ListingStatus.REJECTED) {
            throw new TransitionRejectedException(EntityKind.LISTING, listingId, RejectionReason.INVALID_TRANSITION,
                    "Review decision must be APPROVED or REJECTED, got " + decision);
        }
        return change(listingId, reviewerId, role, current -> decision,
                AuditActions.LISTING_STATUS_UPDATE, reason, null);
    }

    /**
     * Apply the same reviewer decision to several listings. Each listing is handled on its own;
     * a rejection or a missing listing does not affect the others.
     */
    public List<BulkReviewResult> reviewBulk(List<String> listingIds, ListingStatus decision, String reason,
                                             String reviewerId, ActorRole role) {
        List<BulkReviewResult> results = new ArrayList<>();
        for (String listingId : listingIds) {
            try {
                Listing listing = review(listingId, decision, reason, reviewerId, role);
                results.add(BulkReviewResult.accepted(listingId, listing.getStatus()));
            } catch (TransitionRejectedException e) {
                results.add(BulkReviewResult.rejected(listingId, e.getReason().name()));
            } catch (ListingNotFoundException e) {
                results.add(BulkReviewResult.rejected(listingId, "NOT_FOUND"));
            }
        }
        log.info("Bulk review: decision={}, requested={}, accepted={}", decision, listingIds.size(),
                results.stream().filter(BulkReviewResult::isAccepted).count());
        return results;
    }

    // ─── Administration ───────────────────────────────────────────────────────

    /**
     * Reviewer toggles the featured flag. Only an APPROVED listing with healthy stock can be
     * featured; unfeaturing is always allowed.
     */
    public Listing setFeatured(String listingId, boolean featured, String actorId, ActorRole role) {
        return locks.withLock(listingId, () -> {
            for (int attempt = 1; ; attempt++) {
                Listing listing = load(listingId);
                if (role != ActorRole.REVIEWER) {
                    throw reject(listing, RejectionReason.FORBIDDEN_FOR_ROLE, "Only reviewers may feature listings");
                }
                if (featured && (listing.getStatus() != ListingStatus.APPROVED
                        || listing.isBelowStockThreshold(lowStockThreshold))) {
                    throw reject(listing, RejectionReason.INVALID_TRANSITION,
                            "Listing " + listingId + " must be APPROVED with stock of at least " + lowStockThreshold);
                }
                Map<String, Object> before = listing.auditState();
                listing.setFeatured(featured);

                Listing saved;
                try {
                    saved = store.update(listing);
                } catch (OptimisticLockingFailureException e) {
                    retryOrThrow(listingId, attempt, e);
                    continue;
                }

                orchestrator.dispatch(EffectPlan.builder()
                        .entityKind(EntityKind.LISTING)
                        .entityId(listingId)
                        .audit(new AuditEntry(actorId, AuditActions.LISTING_FEATURE, EntityKind.LISTING,
                                listingId, before, saved.auditState()))
                        .search(() -> searchSynchronizer.sync(saved))
                        .build());
                log.info("Listing featured flag set: listingId={}, featured={}, actorId={}", listingId, featured, actorId);
                return saved;
            }
        });
    }

    /**
     * Delete a listing. Allowed for its owner and for reviewers. The search document is removed
     * whatever the last state was.
     */
    public void delete(String listingId, String actorId, ActorRole role) {
        locks.withLock(listingId, () -> {
            for (int attempt = 1; ; attempt++) {
                Listing listing = load(listingId);
                boolean owner = role == ActorRole.SELLER && listing.getOwnerId().equals(actorId);
                if (!owner && role != ActorRole.REVIEWER) {
                    throw reject(listing, RejectionReason.FORBIDDEN_FOR_ROLE, "Only the owner or a reviewer may delete " + listingId);
                }
                try {
                    store.delete(listing);
                } catch (OptimisticLockingFailureException e) {
                    retryOrThrow(listingId, attempt, e);
                    continue;
                }

                EffectPlan.EffectPlanBuilder plan = EffectPlan.builder()
                        .entityKind(EntityKind.LISTING)
                        .entityId(listingId)
                        .audit(new AuditEntry(actorId, AuditActions.LISTING_DELETED, EntityKind.LISTING,
                                listingId, listing.auditState(), null))
                        .search(() -> searchSynchronizer.remove(listingId))
                        .notification(new Notification(ChannelNames.owner(listing.getOwnerId()),
                                EventTypes.LISTING_DELETED, Map.of("listingId", listingId)));
                if (listing.getStatus() == ListingStatus.PENDING_REVIEW) {
                    plan.invalidation(PENDING_COUNT_KEY);
                }
                orchestrator.dispatch(plan.build());
                countTransition("deleted", listing.getStatus().name());
                log.info("Listing deleted: listingId={}, lastStatus={}, actorId={}", listingId, listing.getStatus(), actorId);
                return null;
            }
        });
    }

    // ─── Internals ────────────────────────────────────────────────────────────

    private Listing change(String listingId, String actorId, ActorRole role,
                           Function<ListingStatus, ListingStatus> targetFor,
                           String fixedAction, String reason, ListingEdit edit) {
        return locks.withLock(listingId, () -> {
            for (int attempt = 1; ; attempt++) {
                Listing listing = load(listingId);
                ListingStatus from = listing.getStatus();
                ListingStatus to = targetFor.apply(from);

                if (role == ActorRole.SELLER && !listing.getOwnerId().equals(actorId)) {
                    throw reject(listing, RejectionReason.FORBIDDEN_FOR_ROLE,
                            "Listing " + listingId + " is not owned by " + actorId);
                }

                TransitionDecision decision;
                if (from == ListingStatus.DRAFT && to == ListingStatus.DRAFT) {
                    // content-only edit of a draft
                    if (role != ActorRole.SELLER) {
                        throw reject(listing, RejectionReason.FORBIDDEN_FOR_ROLE, "Only the owner may edit a draft");
                    }
                    decision = TransitionDecision.accept(EnumSet.noneOf(SideEffect.class));
                } else {
                    decision = validator.validate(EntityKind.LISTING, from, to, role);
                }
                if (!decision.isAccepted()) {
                    countTransition("rejected", decision.getReason().name());
                    log.info("Listing transition rejected: listingId={}, from={}, to={}, role={}, reason={}",
                            listingId, from, to, role, decision.getReason());
                    throw new TransitionRejectedException(EntityKind.LISTING, listingId, from, to, decision.getReason());
                }

                Map<String, Object> before = listing.auditState();
                if (edit != null) {
                    edit.applyTo(listing);
                }
                listing.setStatus(to);
                if (to == ListingStatus.APPROVED || to == ListingStatus.REJECTED) {
                    listing.setReviewReason(reason);
                }
                if (decision.declares(SideEffect.UNFEATURE) || listing.isBelowStockThreshold(lowStockThreshold)) {
                    listing.setFeatured(false);
                }

                Listing saved;
                try {
                    saved = store.update(listing);
                } catch (OptimisticLockingFailureException e) {
                    retryOrThrow(listingId, attempt, e);
                    continue;
                }

                String action = fixedAction != null ? fixedAction
                        : from == to ? AuditActions.LISTING_EDIT : AuditActions.LISTING_EDIT_PENDING_REVIEW;
                orchestrator.dispatch(plan(saved, before, decision, actorId, action,
                        edit != null && edit.touchesStock()));
                countTransition("accepted", from + "->" + to);
                log.info("Listing transition: listingId={}, from={}, to={}, actorId={}, role={}",
                        listingId, from, to, actorId, role);
                return saved;
            }
        });
    }

    private EffectPlan plan(Listing saved, Map<String, Object> before, TransitionDecision decision,
                            String actorId, String action, boolean stockEdited) {
        String ownerChannel = ChannelNames.owner(saved.getOwnerId());
        EffectPlan.EffectPlanBuilder plan = EffectPlan.builder()
                .entityKind(EntityKind.LISTING)
                .entityId(saved.getId())
                .audit(new AuditEntry(actorId, action, EntityKind.LISTING, saved.getId(), before, saved.auditState()));

        if (decision.declares(SideEffect.INVALIDATE_COUNT)) {
            plan.invalidation(PENDING_COUNT_KEY);
        }
        if (decision.declares(SideEffect.REINDEX)) {
            plan.search(() -> searchSynchronizer.sync(saved));
        }
        if (decision.declares(SideEffect.NOTIFY_OWNER)) {
            plan.notification(new Notification(ownerChannel, EventTypes.LISTING_STATUS, statusPayload(saved)));
        }
        if (decision.declares(SideEffect.NOTIFY_REVIEWERS)) {
            plan.notification(new Notification(ChannelNames.REVIEWERS, EventTypes.LISTING_NEW, statusPayload(saved)));
        }
        if (stockEdited && saved.isBelowStockThreshold(lowStockThreshold)) {
            String type = saved.getStockQty() <= 0 ? EventTypes.LISTING_OUT_OF_STOCK : EventTypes.LISTING_LOW_STOCK;
            Map<String, Object> payload = Map.of("listingId", saved.getId(), "stockQty", saved.getStockQty());
            plan.notification(new Notification(ownerChannel, type, payload));
            plan.notification(new Notification(ChannelNames.REVIEWERS, type, payload));
        }
        return plan.build();
    }

    private Listing load(String listingId) {
        return store.findById(listingId).orElseThrow(() -> new ListingNotFoundException(listingId));
    }

    private void retryOrThrow(String listingId, int attempt, OptimisticLockingFailureException e) {
        if (attempt >= MAX_OPTIMISTIC_RETRIES) {
            log.warn("Listing write conflict persisted, giving up: listingId={}, attempts={}", listingId, attempt);
            throw e;
        }
        log.debug("Optimistic lock conflict, re-validating: listingId={}, attempt={}", listingId, attempt);
    }

    private TransitionRejectedException reject(Listing listing, RejectionReason reason, String message) {
        countTransition("rejected", reason.name());
        return new TransitionRejectedException(EntityKind.LISTING, listing.getId(), reason, message);
    }

    private void countTransition(String outcome, String detail) {
        meterRegistry.counter("workflow.transitions", "kind", "listing", "outcome", outcome, "detail", detail).increment();
    }

    static Map<String, Object> statusPayload(Listing listing) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("listingId", listing.getId());
        payload.put("name", listing.getName());
        payload.put("status", listing.getStatus().name());
        if (listing.getReviewReason() != null) {
            payload.put("reason", listing.getReviewReason());
        }
        return payload;
    }

    public static class ListingNotFoundException extends RuntimeException {
        public ListingNotFoundException(String listingId) {
            super("Listing not found: " + listingId);
        }
    }
}
