package com.marketplace.shared.workflow;

public enum OrderStatus implements WorkflowState {
    PLACED,
    CONFIRMED,
    ACCEPTED,
    REJECTED,
    PACKED,
    SHIPPED,
    DELIVERED,
    CANCELLED;

    @Override
    public EntityKind kind() {
        return EntityKind.ORDER;
    }

    @Override
    public boolean isTerminal() {
        return this == REJECTED || this == DELIVERED || this == CANCELLED;
    }

    /** Once the parcel has left the seller, the buyer can no longer cancel. */
    public boolean isPastCancellationCutoff() {
        return this == SHIPPED || this == DELIVERED;
    }
}
