package com.marketplace.shared.workflow;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.EnumSet;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit Tests — TransitionValidator
 *
 * Pure logic, no mocks needed.
 */
class TransitionValidatorTest {

    private final StateRegistry registry = new StateRegistry();
    private final TransitionValidator validator = new TransitionValidator(registry);

    // ─── Completeness ─────────────────────────────────────────────────────────

    @Test
    @DisplayName("every (kind, state, target, role) combination yields a decision consistent with the edge table")
    void everyCombinationIsHandled() {
        int accepted = 0;
        for (EntityKind kind : EntityKind.values()) {
            for (WorkflowState current : registry.states(kind)) {
                for (WorkflowState requested : registry.states(kind)) {
                    for (ActorRole role : ActorRole.values()) {
                        TransitionDecision decision = validator.validate(kind, current, requested, role);
                        Optional<StateRegistry.Edge> edge = registry.find(current, requested);

                        if (decision.isAccepted()) {
                            accepted++;
                            assertThat(edge).as("%s %s -> %s by %s", kind, current, requested, role).isPresent();
                            assertThat(edge.get().allows(role)).isTrue();
                            assertThat(decision.getEffects()).isEqualTo(edge.get().getEffects());
                        } else {
                            assertThat(decision.getReason()).isIn((Object[]) RejectionReason.values());
                            assertThat(edge.isPresent() && edge.get().allows(role)
                                    && !current.isTerminal()).isFalse();
                        }
                    }
                }
            }
        }
        assertThat(accepted).isEqualTo(registry.edges(EntityKind.ORDER).size()
                + registry.edges(EntityKind.LISTING).size());
    }

    @Test
    @DisplayName("mixing an order state into a listing request is a programming error")
    void kindMismatchThrows() {
        assertThatThrownBy(() -> validator.validate(EntityKind.LISTING,
                OrderStatus.PLACED, ListingStatus.APPROVED, ActorRole.REVIEWER))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ─── Orders ───────────────────────────────────────────────────────────────

    @ParameterizedTest
    @EnumSource(value = OrderStatus.class, names = {"REJECTED", "DELIVERED", "CANCELLED"})
    @DisplayName("terminal orders reject every request except the late-cancel case")
    void terminalOrdersAreImmutable(OrderStatus terminal) {
        for (OrderStatus target : OrderStatus.values()) {
            for (ActorRole role : ActorRole.values()) {
                TransitionDecision decision = validator.validate(EntityKind.ORDER, terminal, target, role);
                assertThat(decision.isAccepted()).isFalse();
                RejectionReason expected = terminal == OrderStatus.DELIVERED && target == OrderStatus.CANCELLED
                        ? RejectionReason.TOO_LATE_TO_CANCEL
                        : RejectionReason.ALREADY_TERMINAL;
                assertThat(decision.getReason()).isEqualTo(expected);
            }
        }
    }

    @ParameterizedTest
    @EnumSource(value = OrderStatus.class, names = {"PLACED", "CONFIRMED", "ACCEPTED", "PACKED"})
    @DisplayName("buyer may cancel before shipment")
    void buyerCancelsBeforeShipment(OrderStatus from) {
        TransitionDecision decision = validator.validate(EntityKind.ORDER, from, OrderStatus.CANCELLED, ActorRole.BUYER);

        assertThat(decision.isAccepted()).isTrue();
        assertThat(decision.declares(SideEffect.NOTIFY_ORDER_PARTIES)).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = OrderStatus.class, names = {"SHIPPED", "DELIVERED"})
    @DisplayName("cancel after shipment is too late")
    void cancelAfterShipmentIsTooLate(OrderStatus from) {
        TransitionDecision decision = validator.validate(EntityKind.ORDER, from, OrderStatus.CANCELLED, ActorRole.BUYER);

        assertThat(decision.getReason()).isEqualTo(RejectionReason.TOO_LATE_TO_CANCEL);
    }

    @Test
    @DisplayName("seller cannot cancel on the buyer's behalf")
    void sellerCannotCancel() {
        TransitionDecision decision = validator.validate(EntityKind.ORDER,
                OrderStatus.ACCEPTED, OrderStatus.CANCELLED, ActorRole.SELLER);

        assertThat(decision.getReason()).isEqualTo(RejectionReason.FORBIDDEN_FOR_ROLE);
    }

    @Test
    @DisplayName("buyer cannot accept their own order")
    void buyerCannotAccept() {
        assertThat(validator.validate(EntityKind.ORDER, OrderStatus.PLACED, OrderStatus.ACCEPTED, ActorRole.BUYER)
                .getReason()).isEqualTo(RejectionReason.FORBIDDEN_FOR_ROLE);
    }

    @Test
    @DisplayName("skipping a fulfilment step is an invalid transition")
    void skippingStepIsInvalid() {
        assertThat(validator.validate(EntityKind.ORDER, OrderStatus.ACCEPTED, OrderStatus.SHIPPED, ActorRole.SELLER)
                .getReason()).isEqualTo(RejectionReason.INVALID_TRANSITION);
        assertThat(validator.validate(EntityKind.ORDER, OrderStatus.PACKED, OrderStatus.PACKED, ActorRole.SELLER)
                .getReason()).isEqualTo(RejectionReason.INVALID_TRANSITION);
    }

    @Test
    @DisplayName("seller may accept or reject from PLACED and CONFIRMED")
    void sellerBranchPoints() {
        for (OrderStatus from : EnumSet.of(OrderStatus.PLACED, OrderStatus.CONFIRMED)) {
            assertThat(validator.validate(EntityKind.ORDER, from, OrderStatus.ACCEPTED, ActorRole.SELLER).isAccepted()).isTrue();
            assertThat(validator.validate(EntityKind.ORDER, from, OrderStatus.REJECTED, ActorRole.SELLER).isAccepted()).isTrue();
        }
    }

    // ─── Listings ─────────────────────────────────────────────────────────────

    @Test
    @DisplayName("only a reviewer decides a pending listing")
    void onlyReviewerDecides() {
        assertThat(validator.validate(EntityKind.LISTING, ListingStatus.PENDING_REVIEW, ListingStatus.APPROVED, ActorRole.REVIEWER)
                .isAccepted()).isTrue();
        assertThat(validator.validate(EntityKind.LISTING, ListingStatus.PENDING_REVIEW, ListingStatus.APPROVED, ActorRole.SELLER)
                .getReason()).isEqualTo(RejectionReason.FORBIDDEN_FOR_ROLE);
        assertThat(validator.validate(EntityKind.LISTING, ListingStatus.PENDING_REVIEW, ListingStatus.REJECTED, ActorRole.BUYER)
                .getReason()).isEqualTo(RejectionReason.FORBIDDEN_FOR_ROLE);
    }

    @ParameterizedTest
    @EnumSource(value = ListingStatus.class, names = {"DRAFT", "APPROVED", "REJECTED", "PENDING_REVIEW"})
    @DisplayName("owner edit or publish always leads back to review")
    void ownerEditReturnsToReview(ListingStatus from) {
        assertThat(validator.validate(EntityKind.LISTING, from, ListingStatus.PENDING_REVIEW, ActorRole.SELLER)
                .isAccepted()).isTrue();
        assertThat(validator.validate(EntityKind.LISTING, from, ListingStatus.PENDING_REVIEW, ActorRole.REVIEWER)
                .getReason()).isEqualTo(RejectionReason.FORBIDDEN_FOR_ROLE);
    }

    @Test
    @DisplayName("editing an approved listing declares reindex and unfeature")
    void leavingApprovedDeclaresReindexAndUnfeature() {
        TransitionDecision decision = validator.validate(EntityKind.LISTING,
                ListingStatus.APPROVED, ListingStatus.PENDING_REVIEW, ActorRole.SELLER);

        assertThat(decision.getEffects()).contains(SideEffect.REINDEX, SideEffect.UNFEATURE,
                SideEffect.INVALIDATE_COUNT, SideEffect.NOTIFY_REVIEWERS);
    }

    @Test
    @DisplayName("a second decision on an already decided listing is invalid")
    void decidedListingCannotBeDecidedAgain() {
        assertThat(validator.validate(EntityKind.LISTING, ListingStatus.APPROVED, ListingStatus.REJECTED, ActorRole.REVIEWER)
                .getReason()).isEqualTo(RejectionReason.INVALID_TRANSITION);
        assertThat(validator.validate(EntityKind.LISTING, ListingStatus.REJECTED, ListingStatus.APPROVED, ActorRole.REVIEWER)
                .getReason()).isEqualTo(RejectionReason.INVALID_TRANSITION);
        assertThat(validator.validate(EntityKind.LISTING, ListingStatus.DRAFT, ListingStatus.APPROVED, ActorRole.REVIEWER)
                .getReason()).isEqualTo(RejectionReason.INVALID_TRANSITION);
    }

    @Test
    @DisplayName("reading the reason of an accepted decision is an error")
    void acceptedDecisionHasNoReason() {
        TransitionDecision decision = validator.validate(EntityKind.ORDER,
                OrderStatus.PLACED, OrderStatus.CONFIRMED, ActorRole.BUYER);

        assertThatThrownBy(decision::getReason).isInstanceOf(IllegalStateException.class);
    }
}
