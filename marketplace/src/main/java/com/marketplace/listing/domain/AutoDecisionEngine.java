package com.marketplace.listing.domain;

import org.springframework.stereotype.Component;

/**
 * Decides at creation time whether a listing skips manual review.
 *
 * Rule: the owner is trusted AND the listing has at least one image. Pure and total;
 * evaluated once per created listing.
 */
@Component
public class AutoDecisionEngine {

    public AutoDecision decide(ListingDraft draft, boolean ownerTrusted) {
        int imageCount = draft.getImages() != null ? draft.getImages().size() : 0;
        return new AutoDecision(ownerTrusted && imageCount > 0);
    }

    public record AutoDecision(boolean autoApprove) {
    }
}
