package com.marketplace.shared.effects;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Polls effect_failures and replays due records through the matching {@link EffectReconciler}.
 *
 * Failed replays back off exponentially; after the configured number of attempts a record is
 * left for manual inspection.
 */
@Slf4j
@Service
public class ReconciliationRelay {

    private final EffectFailureRepository repository;
    private final Map<EffectStep, EffectReconciler> reconcilers = new EnumMap<>(EffectStep.class);
    private final Counter resolvedCounter;
    private final Counter retryCounter;
    private final Counter exhaustedCounter;

    @Value("${workflow.reconciliation.batch-size:50}")
    private int batchSize;

    @Value("${workflow.reconciliation.max-attempts:5}")
    private int maxAttempts;

    ReconciliationRelay(EffectFailureRepository repository,
                        List<EffectReconciler> reconcilers,
                        MeterRegistry meterRegistry) {
        this.repository = repository;
        reconcilers.forEach(r -> this.reconcilers.put(r.step(), r));
        this.resolvedCounter = Counter.builder("reconciliation.records").tag("outcome", "resolved")
                .register(meterRegistry);
        this.retryCounter = Counter.builder("reconciliation.records").tag("outcome", "retry")
                .register(meterRegistry);
        this.exhaustedCounter = Counter.builder("reconciliation.records").tag("outcome", "exhausted")
                .register(meterRegistry);
    }

    @Scheduled(fixedDelayString = "${workflow.reconciliation.interval-ms:5000}")
    @Transactional
    public void relay() {
        List<EffectFailureRecord> due = repository.findDue(Instant.now(), maxAttempts, batchSize);
        if (due.isEmpty()) return;

        log.debug("Reconciliation: processing {} records", due.size());

        for (EffectFailureRecord failure : due) {
            EffectReconciler reconciler = reconcilers.get(failure.getEffect());
            try {
                if (reconciler == null) {
                    throw new IllegalStateException("No reconciler for effect " + failure.getEffect());
                }
                reconciler.reconcile(failure);
                failure.markResolved();
                resolvedCounter.increment();
                log.info("Effect reconciled: id={}, entityId={}, effect={}, attempt={}",
                        failure.getId(), failure.getEntityId(), failure.getEffect(), failure.getRetryCount() + 1);
            } catch (Exception ex) {
                failure.recordFailure(ex.getMessage());
                if (failure.isExhausted(maxAttempts)) {
                    exhaustedCounter.increment();
                    log.error("Reconciliation exhausted, manual repair needed: id={}, entityKind={}, entityId={}, effect={}, payload={}",
                            failure.getId(), failure.getEntityKind(), failure.getEntityId(),
                            failure.getEffect(), failure.getPayload(), ex);
                } else {
                    retryCounter.increment();
                    log.warn("Reconciliation attempt failed: id={}, entityId={}, effect={}, attempt={}, nextRetryAt={}",
                            failure.getId(), failure.getEntityId(), failure.getEffect(),
                            failure.getRetryCount(), failure.getNextRetryAt());
                }
            }
        }

        repository.saveAll(due);
    }
}
