package com.marketplace.shared.effects;

/**
 * Post-commit steps, in execution order.
 */
public enum EffectStep {
    AUDIT,
    CACHE,
    SEARCH,
    FANOUT
}
