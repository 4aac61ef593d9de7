package com.marketplace.order.domain;

import com.marketplace.listing.domain.Listing;
import com.marketplace.listing.domain.ListingStore;
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

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Order Workflow Service — places orders and moves them through fulfilment.
 *
 * Placement snapshots each listing's price into the order lines; nothing later reads the
 * listing price again. Status changes follow lock → read → validate → versioned write →
 * dispatch effects, like listings.
 */
@Slf4j
@Service
public class OrderWorkflowService {

    private static final int MAX_OPTIMISTIC_RETRIES = 3;
    private static final DateTimeFormatter REFERENCE_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final OrderStore orderStore;
    private final ListingStore listingStore;
    private final TransitionValidator validator;
    private final SideEffectOrchestrator orchestrator;
    private final EntityLocks locks;
    private final MeterRegistry meterRegistry;
    private final String currency;

    public OrderWorkflowService(OrderStore orderStore,
                                ListingStore listingStore,
                                TransitionValidator validator,
                                SideEffectOrchestrator orchestrator,
                                EntityLocks locks,
                                MeterRegistry meterRegistry,
                                @Value("${order.currency:USD}") String currency) {
        this.orderStore = orderStore;
        this.listingStore = listingStore;
        this.validator = validator;
        this.orchestrator = orchestrator;
        this.locks = locks;
        this.meterRegistry = meterRegistry;
        this.currency = currency;
    }

    // ─── Placement ────────────────────────────────────────────────────────────

    /**
     * Place an order in PLACED.
     *
     * Every line must reference an APPROVED listing with enough stock, respect its minimum
     * order quantity, and all lines must belong to the same seller.
     *
     * @throws OrderValidationException when any of these rules fails
     */
    public Order place(PlaceOrderCommand cmd) {
        if (cmd.getItems().isEmpty()) {
            throw new OrderValidationException("An order needs at least one line item");
        }

        List<OrderLine> lines = new ArrayList<>();
        String sellerId = null;
        for (PlaceOrderCommand.Item item : cmd.getItems()) {
            if (item.getQuantity() < 1) {
                throw new OrderValidationException("Quantity must be at least 1 for listing " + item.getListingId());
            }
            Listing listing = listingStore.findById(item.getListingId())
                    .orElseThrow(() -> new OrderValidationException("Listing not found: " + item.getListingId()));
            if (listing.getStatus() != ListingStatus.APPROVED) {
                throw new OrderValidationException("Listing is not available: " + listing.getId());
            }
            if (item.getQuantity() < listing.getMinOrderQty()) {
                throw new OrderValidationException("Minimum order quantity for " + listing.getName()
                        + " is " + listing.getMinOrderQty());
            }
            if (listing.getStockQty() < item.getQuantity()) {
                throw new OrderValidationException("Insufficient stock for " + listing.getName());
            }
            if (sellerId != null && !sellerId.equals(listing.getOwnerId())) {
                throw new OrderValidationException("All items of an order must come from one seller");
            }
            sellerId = listing.getOwnerId();
            lines.add(new OrderLine(listing.getId(), listing.getName(), item.getQuantity(), listing.getPrice()));
        }

        BigDecimal total = lines.stream()
                .map(OrderLine::lineTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        Order order = Order.builder()
                .id("ord_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12))
                .referenceNumber(newReferenceNumber())
                .buyerId(cmd.getBuyerId())
                .sellerId(sellerId)
                .status(OrderStatus.PLACED)
                .lines(lines)
                .totalAmount(total)
                .currency(currency)
                .paymentMethod(cmd.getPaymentMethod())
                .deliveryAddress(cmd.getDeliveryAddress())
                .build();

        Order saved = orderStore.create(order);
        meterRegistry.counter("workflow.transitions", "kind", "order", "outcome", "created", "detail", "PLACED").increment();

        orchestrator.dispatch(EffectPlan.builder()
                .entityKind(EntityKind.ORDER)
                .entityId(saved.getId())
                .audit(new AuditEntry(cmd.getBuyerId(), AuditActions.ORDER_PLACED, EntityKind.ORDER,
                        saved.getId(), null, saved.auditState()))
                .notification(new Notification(ChannelNames.owner(sellerId), EventTypes.ORDER_NEW, updatePayload(saved)))
                .notification(new Notification(ChannelNames.order(saved.getId()), EventTypes.ORDER_UPDATE, updatePayload(saved)))
                .build());

        log.info("Order placed: orderId={}, reference={}, buyerId={}, sellerId={}, totalAmount={}",
                saved.getId(), saved.getReferenceNumber(), saved.getBuyerId(), sellerId, total);
        return saved;
    }

    // ─── Status transitions ───────────────────────────────────────────────────

    /**
     * Move an order to {@code target}. The actor must be the order's buyer (BUYER role) or
     * seller (SELLER role).
     *
     * @throws TransitionRejectedException with the typed reason when the move is not allowed
     */
    public Order transition(String orderId, OrderStatus target, String reason, String actorId, ActorRole role) {
        return locks.withLock(orderId, () -> {
            for (int attempt = 1; ; attempt++) {
                Order order = orderStore.findById(orderId).orElseThrow(() -> new OrderNotFoundException(orderId));
                OrderStatus from = order.getStatus();

                if (!isParty(order, actorId, role)) {
                    countTransition("rejected", RejectionReason.FORBIDDEN_FOR_ROLE.name());
                    throw new TransitionRejectedException(EntityKind.ORDER, orderId, RejectionReason.FORBIDDEN_FOR_ROLE,
                            "Actor " + actorId + " is not the " + role.name().toLowerCase() + " of order " + orderId);
                }

                TransitionDecision decision = validator.validate(EntityKind.ORDER, from, target, role);
                if (!decision.isAccepted()) {
                    countTransition("rejected", decision.getReason().name());
                    log.info("Order transition rejected: orderId={}, from={}, to={}, role={}, reason={}",
                            orderId, from, target, role, decision.getReason());
                    throw new TransitionRejectedException(EntityKind.ORDER, orderId, from, target, decision.getReason());
                }

                Map<String, Object> before = order.auditState();
                order.setStatus(target);
                if (target == OrderStatus.CANCELLED || target == OrderStatus.REJECTED) {
                    order.setStatusReason(reason);
                }

                Order saved;
                try {
                    saved = orderStore.update(order);
                } catch (OptimisticLockingFailureException e) {
                    if (attempt >= MAX_OPTIMISTIC_RETRIES) {
                        log.warn("Order write conflict persisted, giving up: orderId={}, attempts={}", orderId, attempt);
                        throw e;
                    }
                    log.debug("Optimistic lock conflict, re-validating: orderId={}, attempt={}", orderId, attempt);
                    continue;
                }

                EffectPlan.EffectPlanBuilder plan = EffectPlan.builder()
                        .entityKind(EntityKind.ORDER)
                        .entityId(orderId)
                        .audit(new AuditEntry(actorId, AuditActions.ORDER_STATUS_UPDATE, EntityKind.ORDER,
                                orderId, before, saved.auditState()));
                if (decision.declares(SideEffect.NOTIFY_ORDER_PARTIES)) {
                    plan.notification(new Notification(ChannelNames.order(orderId), EventTypes.ORDER_UPDATE, updatePayload(saved)));
                }
                if (decision.declares(SideEffect.NOTIFY_OWNER)) {
                    plan.notification(new Notification(ChannelNames.owner(saved.getSellerId()), EventTypes.ORDER_UPDATE, updatePayload(saved)));
                }
                orchestrator.dispatch(plan.build());

                countTransition("accepted", from + "->" + target);
                log.info("Order transition: orderId={}, from={}, to={}, actorId={}, role={}", orderId, from, target, actorId, role);
                return saved;
            }
        });
    }

    // ─── Internals ────────────────────────────────────────────────────────────

    private boolean isParty(Order order, String actorId, ActorRole role) {
        return switch (role) {
            case BUYER -> order.getBuyerId().equals(actorId);
            case SELLER -> order.getSellerId().equals(actorId);
            default -> true;
        };
    }

    private String newReferenceNumber() {
        return "ORD-" + LocalDate.now(ZoneOffset.UTC).format(REFERENCE_DATE) + "-"
                + UUID.randomUUID().toString().replace("-", "").substring(0, 6).toUpperCase();
    }

    private void countTransition(String outcome, String detail) {
        meterRegistry.counter("workflow.transitions", "kind", "order", "outcome", outcome, "detail", detail).increment();
    }

    private static Map<String, Object> updatePayload(Order order) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("orderId", order.getId());
        payload.put("referenceNumber", order.getReferenceNumber());
        payload.put("status", order.getStatus().name());
        payload.put("totalAmount", order.getTotalAmount());
        if (order.getStatusReason() != null) {
            payload.put("reason", order.getStatusReason());
        }
        return payload;
    }

    public static class OrderNotFoundException extends RuntimeException {
        public OrderNotFoundException(String orderId) {
            super("Order not found: " + orderId);
        }
    }

    public static class OrderValidationException extends RuntimeException {
        public OrderValidationException(String message) {
            super(message);
        }
    }
}
