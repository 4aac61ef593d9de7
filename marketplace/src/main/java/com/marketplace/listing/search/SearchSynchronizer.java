package com.marketplace.listing.search;

import com.marketplace.listing.domain.Listing;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Keeps the index equal to the set of APPROVED listings: sync upserts a discoverable listing and
 * removes anything else.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SearchSynchronizer {

    private final ListingSearchIndex index;

    public void sync(Listing listing) {
        if (listing.getStatus().isDiscoverable()) {
            index.upsert(ListingDocument.from(listing));
        } else {
            index.remove(listing.getId());
        }
    }

    /** Used on deletion, whatever the listing's last state was. */
    public void remove(String listingId) {
        index.remove(listingId);
    }
}
