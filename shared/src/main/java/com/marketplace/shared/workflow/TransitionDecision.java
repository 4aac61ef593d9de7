package com.marketplace.shared.workflow;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Outcome of {@link TransitionValidator#validate}: either accepted with the declared side effects,
 * or rejected with a typed reason. Never both.
 */
@ToString
@EqualsAndHashCode
public final class TransitionDecision {

    private final Set<SideEffect> effects;
    private final RejectionReason reason;

    private TransitionDecision(Set<SideEffect> effects, RejectionReason reason) {
        this.effects = effects;
        this.reason = reason;
    }

    public static TransitionDecision accept(Set<SideEffect> effects) {
        Set<SideEffect> copy = effects.isEmpty() ? EnumSet.noneOf(SideEffect.class) : EnumSet.copyOf(effects);
        return new TransitionDecision(Collections.unmodifiableSet(copy), null);
    }

    public static TransitionDecision reject(RejectionReason reason) {
        return new TransitionDecision(Collections.emptySet(), reason);
    }

    public boolean isAccepted() {
        return reason == null;
    }

    public Set<SideEffect> getEffects() {
        return effects;
    }

    public boolean declares(SideEffect effect) {
        return effects.contains(effect);
    }

    /**
     * @throws IllegalStateException if the decision was an acceptance
     */
    public RejectionReason getReason() {
        if (reason == null) {
            throw new IllegalStateException("Accepted decision has no rejection reason");
        }
        return reason;
    }
}
