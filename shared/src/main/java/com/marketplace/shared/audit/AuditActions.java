package com.marketplace.shared.audit;

import java.util.Set;

/**
 * Action tags written to the audit trail.
 */
public final class AuditActions {

    private AuditActions() {}

    public static final String LISTING_CREATED             = "LISTING_CREATED";
    public static final String LISTING_AUTO_APPROVE        = "LISTING_AUTO_APPROVE";
    public static final String LISTING_PUBLISH             = "LISTING_PUBLISH";
    public static final String LISTING_STATUS_UPDATE       = "LISTING_STATUS_UPDATE";
    public static final String LISTING_EDIT_PENDING_REVIEW = "LISTING_EDIT_PENDING_REVIEW";
    public static final String LISTING_EDIT                = "LISTING_EDIT";
    public static final String LISTING_FEATURE             = "LISTING_FEATURE";
    public static final String LISTING_DELETED             = "LISTING_DELETED";

    public static final String ORDER_PLACED                = "ORDER_PLACED";
    public static final String ORDER_STATUS_UPDATE         = "ORDER_STATUS_UPDATE";

    /** Actions that carry a moderation outcome. Auto-approval is kept apart from reviewer decisions. */
    public static final Set<String> MODERATION_DECISIONS = Set.of(LISTING_STATUS_UPDATE, LISTING_AUTO_APPROVE);
}
