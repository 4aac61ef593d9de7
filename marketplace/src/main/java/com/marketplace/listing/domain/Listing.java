package com.marketplace.listing.domain;

import com.marketplace.shared.workflow.ListingStatus;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Listing JPA Entity.
 *
 * Status changes go through ListingWorkflowService only. Images are an ordered element
 * collection of opaque references.
 */
@Entity
@Table(name = "listings", indexes = {
    @Index(name = "idx_listings_owner_id", columnList = "owner_id"),
    @Index(name = "idx_listings_status", columnList = "status")
})
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Listing {

    @Id
    @Column(name = "id", length = 50)
    private String id;

    @Column(name = "owner_id", nullable = false, length = 50)
    private String ownerId;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    @Column(name = "price", nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(name = "unit", length = 20)
    private String unit;

    @Column(name = "stock_qty", nullable = false)
    private int stockQty;

    @Column(name = "min_order_qty", nullable = false)
    @Builder.Default
    private int minOrderQty = 1;

    @Column(name = "category_id", length = 50)
    private String categoryId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "listing_images", joinColumns = @JoinColumn(name = "listing_id"))
    @OrderColumn(name = "position")
    @Column(name = "image_ref", nullable = false, length = 500)
    @Builder.Default
    private List<String> images = new ArrayList<>();

    @Column(name = "featured", nullable = false)
    private boolean featured;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private ListingStatus status;

    /** Reason given with the last reviewer decision. */
    @Column(name = "review_reason", length = 500)
    private String reviewReason;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = Instant.now();
    }

    /** Detached copy with its own image list. */
    public Listing copy() {
        return toBuilder().images(new ArrayList<>(images)).build();
    }

    public boolean isBelowStockThreshold(int threshold) {
        return stockQty <= 0 || stockQty < threshold;
    }

    /** Snapshot written to the audit trail. */
    public Map<String, Object> auditState() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("listingId", id);
        state.put("status", status != null ? status.name() : null);
        state.put("reason", reviewReason);
        state.put("name", name);
        state.put("price", price);
        state.put("stockQty", stockQty);
        state.put("featured", featured);
        state.put("imageCount", images.size());
        return state;
    }
}
