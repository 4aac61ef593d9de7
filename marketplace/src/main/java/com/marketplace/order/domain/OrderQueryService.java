package com.marketplace.order.domain;

import com.marketplace.shared.audit.AuditRecord;
import com.marketplace.shared.audit.AuditRecorder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class OrderQueryService {

    private final OrderStore orderStore;
    private final AuditRecorder auditRecorder;

    /**
     * Visible to the order's buyer and seller only.
     */
    public Order getOrder(String orderId, String principalId) {
        return orderStore.findById(orderId)
                .filter(order -> order.involves(principalId))
                .orElseThrow(() -> new OrderWorkflowService.OrderNotFoundException(orderId));
    }

    public List<Order> ordersOfBuyer(String buyerId) {
        return orderStore.findByBuyer(buyerId);
    }

    public List<AuditRecord> history(String orderId, String principalId) {
        getOrder(orderId, principalId);
        return auditRecorder.history(orderId);
    }
}
