package com.marketplace.order.api;

import com.marketplace.order.domain.*;
import com.marketplace.shared.audit.AuditRecord;
import com.marketplace.shared.workflow.ActorRole;
import com.marketplace.shared.workflow.OrderStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Order REST Controller.
 *
 * POST /api/orders places an order for the calling buyer; PATCH /api/orders/{id}/status requests
 * any status change (confirm, accept, reject, pack, ship, deliver, cancel), which the workflow
 * validates against the caller's role.
 */
@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderWorkflowService workflowService;
    private final OrderQueryService queryService;

    // ─── Write Endpoints ──────────────────────────────────────────────────────

    @PostMapping
    public ResponseEntity<Map<String, Object>> place(
            @Valid @RequestBody PlaceOrderRequest request,
            @RequestHeader("X-Actor-Id") String actorId) {

        PlaceOrderCommand.PlaceOrderCommandBuilder command = PlaceOrderCommand.builder()
                .buyerId(actorId)
                .paymentMethod(request.getPaymentMethod())
                .deliveryAddress(new DeliveryAddress(
                        request.getAddress().getStreet(),
                        request.getAddress().getCity(),
                        request.getAddress().getState(),
                        request.getAddress().getPostalCode(),
                        request.getAddress().getLandmark()));
        request.getItems().forEach(i -> command.item(new PlaceOrderCommand.Item(i.getListingId(), i.getQuantity())));

        Order order = workflowService.place(command.build());
        return ResponseEntity
                .created(URI.create("/api/orders/" + order.getId()))
                .body(view(order));
    }

    @PatchMapping("/{orderId}/status")
    public ResponseEntity<Map<String, Object>> updateStatus(
            @PathVariable String orderId,
            @Valid @RequestBody StatusUpdateRequest request,
            @RequestHeader("X-Actor-Id") String actorId,
            @RequestHeader("X-Actor-Role") ActorRole role) {
        Order order = workflowService.transition(orderId, request.getStatus(), request.getReason(), actorId, role);
        return ResponseEntity.ok(view(order));
    }

    // ─── Read Endpoints ───────────────────────────────────────────────────────

    @GetMapping("/{orderId}")
    public ResponseEntity<Map<String, Object>> get(
            @PathVariable String orderId,
            @RequestHeader("X-Actor-Id") String actorId) {
        return ResponseEntity.ok(view(queryService.getOrder(orderId, actorId)));
    }

    @GetMapping("/mine")
    public ResponseEntity<List<Map<String, Object>>> mine(@RequestHeader("X-Actor-Id") String actorId) {
        List<Map<String, Object>> orders = new ArrayList<>();
        queryService.ordersOfBuyer(actorId).forEach(o -> orders.add(view(o)));
        return ResponseEntity.ok(orders);
    }

    @GetMapping("/{orderId}/audit")
    public ResponseEntity<Map<String, Object>> audit(
            @PathVariable String orderId,
            @RequestHeader("X-Actor-Id") String actorId) {
        List<Map<String, Object>> records = new ArrayList<>();
        for (AuditRecord r : queryService.history(orderId, actorId)) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("action", r.getAction());
            entry.put("actorId", r.getActorId());
            entry.put("before", r.getBeforeState());
            entry.put("after", r.getAfterState());
            entry.put("occurredAt", r.getOccurredAt());
            records.add(entry);
        }
        return ResponseEntity.ok(Map.of("orderId", orderId, "records", records, "count", records.size()));
    }

    static Map<String, Object> view(Order order) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", order.getId());
        view.put("referenceNumber", order.getReferenceNumber());
        view.put("buyerId", order.getBuyerId());
        view.put("sellerId", order.getSellerId());
        view.put("status", order.getStatus().name());
        view.put("lines", order.getLines());
        view.put("totalAmount", order.getTotalAmount());
        view.put("currency", order.getCurrency());
        view.put("paymentMethod", order.getPaymentMethod().name());
        view.put("deliveryAddress", order.getDeliveryAddress());
        view.put("statusReason", order.getStatusReason());
        view.put("createdAt", order.getCreatedAt());
        return view;
    }
}

// ─── Request DTOs ──────────────────────────────────────────────────────────────

@Data
class PlaceOrderRequest {
    @NotEmpty @Size(max = 50) private List<@Valid LineRequest> items;
    @NotNull private PaymentMethod paymentMethod;
    @Valid @NotNull private AddressRequest address;

    @Data
    static class LineRequest {
        @NotBlank private String listingId;
        @Min(1) private int quantity;
    }

    @Data
    static class AddressRequest {
        @NotBlank private String street;
        @NotBlank private String city;
        @NotBlank private String state;
        @NotBlank @Size(max = 20) private String postalCode;
        private String landmark;
    }
}

@Data
class StatusUpdateRequest {
    @NotNull private OrderStatus status;
    @Size(max = 500) private String reason;
}
