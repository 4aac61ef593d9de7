package com.marketplace.listing.api;

import com.marketplace.listing.domain.*;
import com.marketplace.shared.audit.AuditRecord;
import com.marketplace.shared.workflow.ActorRole;
import com.marketplace.shared.workflow.ListingStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Listing REST Controller.
 *
 * Thin translation from HTTP to ListingWorkflowService / ListingQueryService. Caller identity
 * arrives already resolved in the X-Actor-Id / X-Actor-Role headers; X-Actor-Trusted carries the
 * owner's trust flag used by the auto-decision.
 */
@RestController
@RequestMapping("/api/listings")
@RequiredArgsConstructor
public class ListingController {

    private final ListingWorkflowService workflowService;
    private final ListingQueryService queryService;

    // ─── Write Endpoints ──────────────────────────────────────────────────────

    @PostMapping
    public ResponseEntity<Map<String, Object>> create(
            @Valid @RequestBody CreateListingRequest request,
            @RequestHeader("X-Actor-Id") String actorId,
            @RequestHeader(value = "X-Actor-Trusted", defaultValue = "false") boolean trusted) {

        ListingDraft draft = ListingDraft.builder()
                .name(request.getName())
                .description(request.getDescription())
                .price(request.getPrice())
                .unit(request.getUnit())
                .stockQty(request.getStockQty())
                .minOrderQty(request.getMinOrderQty() != null ? request.getMinOrderQty() : 1)
                .categoryId(request.getCategoryId())
                .images(request.getImages() != null ? request.getImages() : List.of())
                .build();

        Listing listing = workflowService.create(draft, actorId, trusted, request.isSubmit());
        return ResponseEntity
                .created(URI.create("/api/listings/" + listing.getId()))
                .body(view(listing));
    }

    @PatchMapping("/{listingId}")
    public ResponseEntity<Map<String, Object>> edit(
            @PathVariable String listingId,
            @Valid @RequestBody EditListingRequest request,
            @RequestHeader("X-Actor-Id") String actorId,
            @RequestHeader("X-Actor-Role") ActorRole role) {

        ListingEdit edit = ListingEdit.builder()
                .name(request.getName())
                .description(request.getDescription())
                .price(request.getPrice())
                .unit(request.getUnit())
                .stockQty(request.getStockQty())
                .minOrderQty(request.getMinOrderQty())
                .categoryId(request.getCategoryId())
                .images(request.getImages())
                .build();
        return ResponseEntity.ok(view(workflowService.edit(listingId, edit, actorId, role)));
    }

    @PostMapping("/{listingId}/publish")
    public ResponseEntity<Map<String, Object>> publish(
            @PathVariable String listingId,
            @RequestHeader("X-Actor-Id") String actorId,
            @RequestHeader("X-Actor-Role") ActorRole role) {
        return ResponseEntity.ok(view(workflowService.publish(listingId, actorId, role)));
    }

    @PostMapping("/{listingId}/review")
    public ResponseEntity<Map<String, Object>> review(
            @PathVariable String listingId,
            @Valid @RequestBody ReviewRequest request,
            @RequestHeader("X-Actor-Id") String actorId,
            @RequestHeader("X-Actor-Role") ActorRole role) {
        return ResponseEntity.ok(view(workflowService.review(
                listingId, request.getStatus(), request.getReason(), actorId, role)));
    }

    @PatchMapping("/admin/bulk-status")
    public ResponseEntity<Map<String, Object>> reviewBulk(
            @Valid @RequestBody BulkReviewRequest request,
            @RequestHeader("X-Actor-Id") String actorId,
            @RequestHeader("X-Actor-Role") ActorRole role) {
        List<BulkReviewResult> results = workflowService.reviewBulk(
                request.getListingIds(), request.getStatus(), request.getReason(), actorId, role);
        return ResponseEntity.ok(Map.of(
                "results", results,
                "updated", results.stream().filter(BulkReviewResult::isAccepted).count()));
    }

    @PatchMapping("/{listingId}/featured")
    public ResponseEntity<Map<String, Object>> setFeatured(
            @PathVariable String listingId,
            @Valid @RequestBody FeatureRequest request,
            @RequestHeader("X-Actor-Id") String actorId,
            @RequestHeader("X-Actor-Role") ActorRole role) {
        return ResponseEntity.ok(view(workflowService.setFeatured(listingId, request.getFeatured(), actorId, role)));
    }

    @DeleteMapping("/{listingId}")
    public ResponseEntity<Void> delete(
            @PathVariable String listingId,
            @RequestHeader("X-Actor-Id") String actorId,
            @RequestHeader("X-Actor-Role") ActorRole role) {
        workflowService.delete(listingId, actorId, role);
        return ResponseEntity.noContent().build();
    }

    // ─── Read Endpoints ───────────────────────────────────────────────────────

    @GetMapping("/{listingId}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable String listingId) {
        return ResponseEntity.ok(view(queryService.getListing(listingId)));
    }

    @GetMapping("/admin/pending/count")
    public ResponseEntity<Map<String, Object>> pendingCount() {
        return ResponseEntity.ok(Map.of("pending", queryService.pendingReviewCount()));
    }

    /** Why the listing is in its current moderation state. */
    @GetMapping("/{listingId}/moderation")
    public ResponseEntity<Map<String, Object>> moderation(@PathVariable String listingId) {
        return queryService.moderationDecision(listingId)
                .map(record -> ResponseEntity.ok(auditView(record)))
                .orElse(ResponseEntity.noContent().build());
    }

    @GetMapping("/{listingId}/audit")
    public ResponseEntity<Map<String, Object>> audit(@PathVariable String listingId) {
        List<Map<String, Object>> records = new ArrayList<>();
        queryService.history(listingId).forEach(r -> records.add(auditView(r)));
        return ResponseEntity.ok(Map.of("listingId", listingId, "records", records, "count", records.size()));
    }

    static Map<String, Object> view(Listing listing) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", listing.getId());
        view.put("ownerId", listing.getOwnerId());
        view.put("name", listing.getName());
        view.put("description", listing.getDescription());
        view.put("price", listing.getPrice());
        view.put("unit", listing.getUnit());
        view.put("stockQty", listing.getStockQty());
        view.put("minOrderQty", listing.getMinOrderQty());
        view.put("categoryId", listing.getCategoryId());
        view.put("images", listing.getImages());
        view.put("featured", listing.isFeatured());
        view.put("status", listing.getStatus().name());
        view.put("reviewReason", listing.getReviewReason());
        view.put("version", listing.getVersion());
        return view;
    }

    static Map<String, Object> auditView(AuditRecord record) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", record.getId());
        view.put("action", record.getAction());
        view.put("actorId", record.getActorId());
        view.put("before", record.getBeforeState());
        view.put("after", record.getAfterState());
        view.put("occurredAt", record.getOccurredAt());
        return view;
    }
}

// ─── Request DTOs ──────────────────────────────────────────────────────────────

@Data
class CreateListingRequest {
    @NotBlank @Size(max = 200) private String name;
    @Size(max = 5000) private String description;
    @NotNull @Positive private BigDecimal price;
    @Size(max = 20) private String unit;
    @Min(0) private int stockQty;
    @Min(1) private Integer minOrderQty;
    private String categoryId;
    @Size(max = 10) private List<@NotBlank String> images;
    /** false saves a draft */
    private boolean submit = true;
}

@Data
class EditListingRequest {
    @Size(max = 200) private String name;
    @Size(max = 5000) private String description;
    @Positive private BigDecimal price;
    @Size(max = 20) private String unit;
    @Min(0) private Integer stockQty;
    @Min(1) private Integer minOrderQty;
    private String categoryId;
    @Size(max = 10) private List<@NotBlank String> images;
}

@Data
class ReviewRequest {
    @NotNull private ListingStatus status;
    @Size(max = 500) private String reason;
}

@Data
class BulkReviewRequest {
    @NotEmpty @Size(max = 100) private List<@NotBlank String> listingIds;
    @NotNull private ListingStatus status;
    @Size(max = 500) private String reason;
}

@Data
class FeatureRequest {
    @NotNull private Boolean featured;
}
