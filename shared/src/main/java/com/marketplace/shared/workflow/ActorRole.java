package com.marketplace.shared.workflow;

/**
 * Role of the caller requesting a transition, resolved upstream by the authorization layer.
 *
 * SELLER doubles as the listing owner. SYSTEM is used for automated decisions and owns no edges.
 */
public enum ActorRole {
    BUYER,
    SELLER,
    REVIEWER,
    SYSTEM
}
