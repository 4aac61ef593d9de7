package com.marketplace.shared.workflow;

public enum RejectionReason {
    /** No edge between the current and requested state. */
    INVALID_TRANSITION,
    /** The edge exists but the caller's role may not take it. */
    FORBIDDEN_FOR_ROLE,
    /** The entity is in a terminal state. */
    ALREADY_TERMINAL,
    /** Cancellation requested after the order shipped. */
    TOO_LATE_TO_CANCEL
}
