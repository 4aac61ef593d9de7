package com.marketplace.listing.search;

import com.marketplace.listing.domain.ListingStore;
import com.marketplace.shared.effects.EffectFailureRecord;
import com.marketplace.shared.effects.EffectReconciler;
import com.marketplace.shared.effects.EffectStep;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Replays a failed search step from the listing's current durable state rather than from the
 * failed payload, so a late replay cannot resurrect an outdated document.
 */
@Component
@RequiredArgsConstructor
class ListingSearchReconciler implements EffectReconciler {

    private final ListingStore listingStore;
    private final SearchSynchronizer searchSynchronizer;

    @Override
    public EffectStep step() {
        return EffectStep.SEARCH;
    }

    @Override
    public void reconcile(EffectFailureRecord failure) {
        listingStore.findById(failure.getEntityId())
                .ifPresentOrElse(searchSynchronizer::sync,
                        () -> searchSynchronizer.remove(failure.getEntityId()));
    }
}
