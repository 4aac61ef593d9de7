package com.marketplace.shared.effects;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketplace.shared.audit.AuditEntry;
import com.marketplace.shared.audit.AuditRecorder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Re-appends an audit entry from the payload stored with the failure.
 */
@Component
@RequiredArgsConstructor
class AuditReconciler implements EffectReconciler {

    private final AuditRecorder auditRecorder;
    private final ObjectMapper objectMapper;

    @Override
    public EffectStep step() {
        return EffectStep.AUDIT;
    }

    @Override
    public void reconcile(EffectFailureRecord failure) throws Exception {
        auditRecorder.record(objectMapper.readValue(failure.getPayload(), AuditEntry.class));
    }
}
