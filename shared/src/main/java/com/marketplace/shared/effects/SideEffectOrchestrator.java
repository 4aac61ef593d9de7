package com.marketplace.shared.effects;

import com.marketplace.shared.audit.AuditRecorder;
import com.marketplace.shared.cache.CacheSynchronizer;
import com.marketplace.shared.fanout.ChannelPublisher;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Executes the post-commit part of a transition: audit, cache, search, fan-out, in that order.
 *
 * Must only be called after the state write committed. Each step is isolated: a failure is
 * logged with entity, effect and payload, counted, and (except fan-out, which is at-most-once)
 * written to the {@link EffectFailureLedger} for the reconciliation relay. Nothing here ever
 * reaches back into the committed state or the caller.
 *
 * Plans for the same entity run in commit order on a per-entity lane; the caller never waits.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SideEffectOrchestrator {

    private final AuditRecorder auditRecorder;
    private final CacheSynchronizer cacheSynchronizer;
    private final ChannelPublisher channelPublisher;
    private final EffectFailureLedger failureLedger;
    private final KeyedSerialExecutor effectExecutor;
    private final MeterRegistry meterRegistry;

    public void dispatch(EffectPlan plan) {
        effectExecutor.execute(plan.lane(), () -> execute(plan));
    }

    void execute(EffectPlan plan) {
        if (plan.getAudit() != null) {
            runStep(plan, EffectStep.AUDIT, plan.getAudit(), () -> auditRecorder.record(plan.getAudit()));
        }
        for (String key : plan.getInvalidations()) {
            runStep(plan, EffectStep.CACHE, Map.of("key", key), () -> cacheSynchronizer.invalidate(key));
        }
        if (plan.getSearch() != null) {
            runStep(plan, EffectStep.SEARCH, Map.of("entityId", plan.getEntityId()), plan.getSearch());
        }
        for (Notification notification : plan.getNotifications()) {
            try {
                channelPublisher.publish(notification.channel(), notification.eventType(), notification.payload());
                count(EffectStep.FANOUT, "success");
            } catch (RuntimeException e) {
                count(EffectStep.FANOUT, "failure");
                log.warn("Fan-out failed, event dropped: entityId={}, channel={}, type={}, payload={}",
                        plan.getEntityId(), notification.channel(), notification.eventType(),
                        notification.payload(), e);
            }
        }
    }

    private void runStep(EffectPlan plan, EffectStep step, Object payload, Runnable action) {
        try {
            action.run();
            count(step, "success");
        } catch (RuntimeException e) {
            count(step, "failure");
            log.warn("Side effect failed, queued for reconciliation: entityKind={}, entityId={}, effect={}, payload={}, error={}",
                    plan.getEntityKind(), plan.getEntityId(), step, payload, e.getMessage(), e);
            failureLedger.record(plan.getEntityKind(), plan.getEntityId(), step, payload, e);
        }
    }

    private void count(EffectStep step, String outcome) {
        meterRegistry.counter("workflow.effects", "effect", step.name(), "outcome", outcome).increment();
    }
}
