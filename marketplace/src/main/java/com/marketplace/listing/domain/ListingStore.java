package com.marketplace.listing.domain;

import com.marketplace.shared.workflow.ListingStatus;

import java.util.Optional;

/**
 * The create/read/update-with-version primitives the workflow needs from the durable store.
 *
 * Implementations hand out detached instances: changing a returned listing has no effect until
 * it is passed to {@link #update}.
 */
public interface ListingStore {

    Listing create(Listing listing);

    Optional<Listing> findById(String id);

    /**
     * @return the stored listing carrying its new version
     * @throws org.springframework.dao.OptimisticLockingFailureException if the listing changed
     *         since it was read
     */
    Listing update(Listing listing);

    /**
     * @throws org.springframework.dao.OptimisticLockingFailureException if the listing changed
     *         since it was read
     */
    void delete(Listing listing);

    long countByStatus(ListingStatus status);
}
