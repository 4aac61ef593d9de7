package com.marketplace.shared.workflow;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Accepts or rejects a requested state change.
 *
 * Rejection is a value, never an exception. Rule precedence:
 * <ol>
 *   <li>cancelling a shipped or delivered order: {@code TOO_LATE_TO_CANCEL}</li>
 *   <li>any other request from a terminal state: {@code ALREADY_TERMINAL}</li>
 *   <li>no edge between the two states: {@code INVALID_TRANSITION}</li>
 *   <li>edge exists, role not on it: {@code FORBIDDEN_FOR_ROLE}</li>
 * </ol>
 * The role is trusted as given.
 */
@Component
@RequiredArgsConstructor
public class TransitionValidator {

    private final StateRegistry registry;

    public TransitionDecision validate(EntityKind kind, WorkflowState current,
                                       WorkflowState requested, ActorRole role) {
        if (current.kind() != kind || requested.kind() != kind) {
            throw new IllegalArgumentException("State does not belong to " + kind
                    + ": current=" + current + ", requested=" + requested);
        }

        if (requested == OrderStatus.CANCELLED && current instanceof OrderStatus
                && ((OrderStatus) current).isPastCancellationCutoff()) {
            return TransitionDecision.reject(RejectionReason.TOO_LATE_TO_CANCEL);
        }
        if (current.isTerminal()) {
            return TransitionDecision.reject(RejectionReason.ALREADY_TERMINAL);
        }

        Optional<StateRegistry.Edge> edge = registry.find(current, requested);
        if (edge.isEmpty()) {
            return TransitionDecision.reject(RejectionReason.INVALID_TRANSITION);
        }
        if (!edge.get().allows(role)) {
            return TransitionDecision.reject(RejectionReason.FORBIDDEN_FOR_ROLE);
        }
        return TransitionDecision.accept(edge.get().getEffects());
    }
}
