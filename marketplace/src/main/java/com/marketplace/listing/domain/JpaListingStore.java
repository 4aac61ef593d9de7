package com.marketplace.listing.domain;

import com.marketplace.shared.workflow.ListingStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Component;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Repository
interface ListingRepository extends JpaRepository<Listing, String> {
    long countByStatus(ListingStatus status);
}

/**
 * Listing store on PostgreSQL. Each call is its own transaction, so by the time
 * {@link #update} returns the new state is committed. The {@code @Version} column turns a stale
 * write into an ObjectOptimisticLockingFailureException.
 */
@Component
@RequiredArgsConstructor
class JpaListingStore implements ListingStore {

    private final ListingRepository repository;

    @Override
    @Transactional
    public Listing create(Listing listing) {
        return repository.save(listing);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Listing> findById(String id) {
        return repository.findById(id);
    }

    @Override
    @Transactional
    public Listing update(Listing listing) {
        return repository.saveAndFlush(listing);
    }

    @Override
    @Transactional
    public void delete(Listing listing) {
        repository.delete(listing);
        repository.flush();
    }

    @Override
    @Transactional(readOnly = true)
    public long countByStatus(ListingStatus status) {
        return repository.countByStatus(status);
    }
}
