package com.marketplace.order.domain;

import com.marketplace.shared.workflow.OrderStatus;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Order JPA Entity.
 *
 * Never deleted; it ends in one of the terminal states. Only the status and its reason change
 * after placement.
 */
@Entity
@Table(name = "orders", indexes = {
    @Index(name = "idx_orders_buyer_id", columnList = "buyer_id"),
    @Index(name = "idx_orders_seller_id", columnList = "seller_id"),
    @Index(name = "idx_orders_status", columnList = "status"),
    @Index(name = "idx_orders_reference", columnList = "reference_number", unique = true)
})
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    @Id
    @Column(name = "id", length = 50)
    private String id;

    @Column(name = "reference_number", nullable = false, length = 30, updatable = false)
    private String referenceNumber;

    @Column(name = "buyer_id", nullable = false, length = 50, updatable = false)
    private String buyerId;

    @Column(name = "seller_id", nullable = false, length = 50, updatable = false)
    private String sellerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 30)
    private OrderStatus status;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "order_lines", joinColumns = @JoinColumn(name = "order_id"))
    @OrderColumn(name = "line_no")
    @Setter(AccessLevel.NONE)
    @Builder.Default
    private List<OrderLine> lines = new ArrayList<>();

    @Column(name = "total_amount", nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal totalAmount;

    @Column(name = "currency", nullable = false, length = 3, updatable = false)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, length = 10, updatable = false)
    private PaymentMethod paymentMethod;

    @Embedded
    private DeliveryAddress deliveryAddress;

    /** Reason given with a cancellation or rejection. */
    @Column(name = "status_reason", length = 500)
    private String statusReason;

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

    public Order copy() {
        return toBuilder().lines(new ArrayList<>(lines)).build();
    }

    public boolean involves(String principalId) {
        return buyerId.equals(principalId) || sellerId.equals(principalId);
    }

    public Map<String, Object> auditState() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("orderId", id);
        state.put("referenceNumber", referenceNumber);
        state.put("status", status.name());
        state.put("reason", statusReason);
        state.put("totalAmount", totalAmount);
        return state;
    }
}
