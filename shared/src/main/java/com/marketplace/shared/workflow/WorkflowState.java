package com.marketplace.shared.workflow;

/**
 * Common view over {@link OrderStatus} and {@link ListingStatus}.
 */
public interface WorkflowState {

    EntityKind kind();

    boolean isTerminal();

    String name();
}
