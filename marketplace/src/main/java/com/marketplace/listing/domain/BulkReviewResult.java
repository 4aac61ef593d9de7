package com.marketplace.listing.domain;

import com.marketplace.shared.workflow.ListingStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Per-listing outcome of a bulk review.
 */
@Getter
@AllArgsConstructor
public class BulkReviewResult {
    private final String listingId;
    private final boolean accepted;
    private final ListingStatus status;
    private final String reason;

    static BulkReviewResult accepted(String listingId, ListingStatus status) {
        return new BulkReviewResult(listingId, true, status, null);
    }

    static BulkReviewResult rejected(String listingId, String reason) {
        return new BulkReviewResult(listingId, false, null, reason);
    }
}
