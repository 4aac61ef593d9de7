package com.marketplace.listing.api;

import com.marketplace.api.ApiExceptionHandler;
import com.marketplace.listing.domain.*;
import com.marketplace.listing.search.InMemoryListingSearchIndex;
import com.marketplace.listing.search.SearchSynchronizer;
import com.marketplace.shared.effects.SideEffectOrchestrator;
import com.marketplace.shared.locking.EntityLocks;
import com.marketplace.shared.workflow.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class ListingControllerTest {

    @Mock ListingWorkflowService workflowService;
    @Mock ListingQueryService queryService;

    MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ListingController(workflowService, queryService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    private Listing listing(ListingStatus status) {
        return Listing.builder()
                .id("lst_1").ownerId("sel_1").name("Sourdough").price(new BigDecimal("6.00"))
                .stockQty(12).images(List.of("img/1.jpg")).status(status).version(1L).build();
    }

    @Test
    @DisplayName("POST /api/listings creates with the owner's trust flag and returns 201")
    void create() throws Exception {
        when(workflowService.create(any(), eq("sel_1"), eq(true), eq(true))).thenReturn(listing(ListingStatus.APPROVED));

        mockMvc.perform(post("/api/listings")
                        .header("X-Actor-Id", "sel_1")
                        .header("X-Actor-Trusted", "true")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"Sourdough","price":6.00,"stockQty":12,"images":["img/1.jpg"]}
                                """))
                .andExpect(status().isCreated())
                .andExpect(header().string("Location", "/api/listings/lst_1"))
                .andExpect(jsonPath("$.status").value("APPROVED"));

        ArgumentCaptor<ListingDraft> draft = ArgumentCaptor.forClass(ListingDraft.class);
        verify(workflowService).create(draft.capture(), eq("sel_1"), eq(true), eq(true));
        assertThat(draft.getValue().getMinOrderQty()).isEqualTo(1);
        assertThat(draft.getValue().getImages()).containsExactly("img/1.jpg");
    }

    @Test
    @DisplayName("invalid body is a 400 and never reaches the workflow")
    void invalidBody() throws Exception {
        mockMvc.perform(post("/api/listings")
                        .header("X-Actor-Id", "sel_1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"","price":-1,"stockQty":1}
                                """))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(workflowService);
    }

    @Test
    @DisplayName("review with a non-decision status is a 409 INVALID_TRANSITION, not a server error")
    void reviewWithNonDecisionStatus() throws Exception {
        ListingStore store = mock(ListingStore.class);
        SideEffectOrchestrator orchestrator = mock(SideEffectOrchestrator.class);
        ListingWorkflowService realService = new ListingWorkflowService(store,
                new TransitionValidator(new StateRegistry()), new AutoDecisionEngine(),
                new SearchSynchronizer(new InMemoryListingSearchIndex()), orchestrator, new EntityLocks(),
                new SimpleMeterRegistry(), 5);
        MockMvc realMvc = MockMvcBuilders.standaloneSetup(new ListingController(realService, queryService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();

        realMvc.perform(post("/api/listings/lst_1/review")
                        .header("X-Actor-Id", "rev_1")
                        .header("X-Actor-Role", "REVIEWER")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"DRAFT\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.reason").value("INVALID_TRANSITION"));

        realMvc.perform(patch("/api/listings/admin/bulk-status")
                        .header("X-Actor-Id", "rev_1")
                        .header("X-Actor-Role", "REVIEWER")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"listingIds\":[\"lst_1\",\"lst_2\"],\"status\":\"PENDING_REVIEW\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.updated").value(0))
                .andExpect(jsonPath("$.results[1].reason").value("INVALID_TRANSITION"));

        verifyNoInteractions(store, orchestrator);
    }

    @Test
    @DisplayName("review rejected for role maps to 403 with the typed reason")
    void forbiddenReview() throws Exception {
        when(workflowService.review("lst_1", ListingStatus.APPROVED, null, "sel_1", ActorRole.SELLER))
                .thenThrow(new TransitionRejectedException(EntityKind.LISTING, "lst_1",
                        ListingStatus.PENDING_REVIEW, ListingStatus.APPROVED, RejectionReason.FORBIDDEN_FOR_ROLE));

        mockMvc.perform(post("/api/listings/lst_1/review")
                        .header("X-Actor-Id", "sel_1")
                        .header("X-Actor-Role", "SELLER")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"APPROVED\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.reason").value("FORBIDDEN_FOR_ROLE"));
    }

    @Test
    @DisplayName("invalid transition maps to 409")
    void invalidTransition() throws Exception {
        when(workflowService.publish("lst_1", "sel_1", ActorRole.SELLER))
                .thenThrow(new TransitionRejectedException(EntityKind.LISTING, "lst_1",
                        ListingStatus.APPROVED, ListingStatus.PENDING_REVIEW, RejectionReason.INVALID_TRANSITION));

        mockMvc.perform(post("/api/listings/lst_1/publish")
                        .header("X-Actor-Id", "sel_1")
                        .header("X-Actor-Role", "SELLER"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.reason").value("INVALID_TRANSITION"));
    }

    @Test
    @DisplayName("exhausted optimistic retries map to 409 CONCURRENT_MODIFICATION")
    void concurrentModification() throws Exception {
        when(workflowService.setFeatured("lst_1", true, "rev_1", ActorRole.REVIEWER))
                .thenThrow(new ObjectOptimisticLockingFailureException(Listing.class, "lst_1"));

        mockMvc.perform(patch("/api/listings/lst_1/featured")
                        .header("X-Actor-Id", "rev_1")
                        .header("X-Actor-Role", "REVIEWER")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"featured\":true}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.reason").value("CONCURRENT_MODIFICATION"));
    }

    @Test
    @DisplayName("unknown listing is a 404 and an unknown role header is a 400")
    void notFoundAndBadRole() throws Exception {
        when(queryService.getListing("lst_missing"))
                .thenThrow(new ListingWorkflowService.ListingNotFoundException("lst_missing"));

        mockMvc.perform(get("/api/listings/lst_missing"))
                .andExpect(status().isNotFound());

        mockMvc.perform(delete("/api/listings/lst_1")
                        .header("X-Actor-Id", "x")
                        .header("X-Actor-Role", "ADMIN"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(workflowService);
    }

    @Test
    @DisplayName("bulk review reports per-listing outcomes and the updated count")
    void bulkReview() throws Exception {
        when(workflowService.reviewBulk(List.of("lst_1", "lst_2"), ListingStatus.REJECTED, "spam", "rev_1", ActorRole.REVIEWER))
                .thenReturn(List.of(
                        new BulkReviewResult("lst_1", true, ListingStatus.REJECTED, null),
                        new BulkReviewResult("lst_2", false, null, "NOT_FOUND")));

        mockMvc.perform(patch("/api/listings/admin/bulk-status")
                        .header("X-Actor-Id", "rev_1")
                        .header("X-Actor-Role", "REVIEWER")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"listingIds":["lst_1","lst_2"],"status":"REJECTED","reason":"spam"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.updated").value(1))
                .andExpect(jsonPath("$.results[1].reason").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("pending count comes from the query service")
    void pendingCount() throws Exception {
        when(queryService.pendingReviewCount()).thenReturn(7L);

        mockMvc.perform(get("/api/listings/admin/pending/count"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pending").value(7));
    }
}
