package com.marketplace.shared.effects;

/**
 * Replays one kind of failed effect. Implementations must be idempotent: a record can be
 * replayed after a partial success.
 */
public interface EffectReconciler {

    EffectStep step();

    void reconcile(EffectFailureRecord failure) throws Exception;
}
