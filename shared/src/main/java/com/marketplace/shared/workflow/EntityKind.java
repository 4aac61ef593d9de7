package com.marketplace.shared.workflow;

/**
 * The two entity kinds whose lifecycle is governed by the workflow engine.
 */
public enum EntityKind {
    ORDER,
    LISTING
}
