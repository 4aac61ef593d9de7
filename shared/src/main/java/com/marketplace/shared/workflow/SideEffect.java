package com.marketplace.shared.workflow;

/**
 * Effect tags declared by an accepted transition. The validator only names them;
 * the owning workflow service turns them into an effect plan.
 */
public enum SideEffect {
    /** Re-sync the search document: upsert when discoverable, otherwise remove. */
    REINDEX,
    /** Drop cached aggregates whose membership changed. */
    INVALIDATE_COUNT,
    /** Clear the featured flag. Applied inside the state write, not post-commit. */
    UNFEATURE,
    NOTIFY_OWNER,
    NOTIFY_REVIEWERS,
    NOTIFY_ORDER_PARTIES
}
