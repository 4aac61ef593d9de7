package com.marketplace.listing.domain;

import com.marketplace.shared.audit.AuditActions;
import com.marketplace.shared.audit.AuditRecord;
import com.marketplace.shared.audit.AuditRecorder;
import com.marketplace.shared.cache.CacheSynchronizer;
import com.marketplace.shared.workflow.ListingStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.function.LongSupplier;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ListingQueryServiceTest {

    @Mock CacheSynchronizer cache;
    @Mock AuditRecorder auditRecorder;

    InMemoryListingStore store;
    ListingQueryService queryService;

    @BeforeEach
    void setUp() {
        store = new InMemoryListingStore();
        queryService = new ListingQueryService(store, cache, auditRecorder, 15);
    }

    private Listing seed(String id, ListingStatus status) {
        return store.seed(Listing.builder()
                .id(id).ownerId("sel_1").name("Jam").price(BigDecimal.ONE).stockQty(10)
                .status(status).build());
    }

    @Test
    @DisplayName("pending count goes through the derived cache and falls back to counting the store")
    void pendingCountUsesCache() {
        seed("lst_1", ListingStatus.PENDING_REVIEW);
        seed("lst_2", ListingStatus.PENDING_REVIEW);
        seed("lst_3", ListingStatus.APPROVED);
        when(cache.getOrComputeCount(eq(ListingWorkflowService.PENDING_COUNT_KEY), eq(15L), any()))
                .thenAnswer(inv -> inv.<LongSupplier>getArgument(2).getAsLong());

        assertThat(queryService.pendingReviewCount()).isEqualTo(2);

        ArgumentCaptor<LongSupplier> compute = ArgumentCaptor.forClass(LongSupplier.class);
        verify(cache).getOrComputeCount(anyString(), anyLong(), compute.capture());
        seed("lst_4", ListingStatus.PENDING_REVIEW);
        assertThat(compute.getValue().getAsLong()).isEqualTo(3);
    }

    @Test
    @DisplayName("moderation decision is the latest reviewer or auto-approval record")
    void moderationDecision() {
        seed("lst_1", ListingStatus.APPROVED);
        AuditRecord record = AuditRecord.builder()
                .id("aud_1").entityId("lst_1").actorId("SYSTEM").action(AuditActions.LISTING_AUTO_APPROVE).build();
        when(auditRecorder.latestModerationDecision("lst_1")).thenReturn(Optional.of(record));

        assertThat(queryService.moderationDecision("lst_1")).contains(record);
    }

    @Test
    @DisplayName("moderation decision of an unknown listing is not found")
    void moderationDecisionUnknownListing() {
        assertThatThrownBy(() -> queryService.moderationDecision("lst_missing"))
                .isInstanceOf(ListingWorkflowService.ListingNotFoundException.class);
        verifyNoInteractions(auditRecorder);
    }
}
