package com.marketplace.shared.workflow;

import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.marketplace.shared.workflow.ActorRole.BUYER;
import static com.marketplace.shared.workflow.ActorRole.REVIEWER;
import static com.marketplace.shared.workflow.ActorRole.SELLER;
import static com.marketplace.shared.workflow.SideEffect.*;

/**
 * Static definition of the legal transitions for orders and listings.
 *
 * Each edge carries the roles allowed to take it and the side effects it declares.
 * Pure data: no lookups, no I/O.
 *
 * <pre>
 * Order
 *   PLACED            --BUYER-->  CONFIRMED
 *   PLACED|CONFIRMED  --SELLER--> ACCEPTED | REJECTED*
 *   PLACED|CONFIRMED|ACCEPTED|PACKED --BUYER--> CANCELLED*
 *   ACCEPTED --SELLER--> PACKED --SELLER--> SHIPPED --SELLER--> DELIVERED*
 *
 * Listing
 *   DRAFT --SELLER(publish)--> PENDING_REVIEW
 *   PENDING_REVIEW --REVIEWER--> APPROVED | REJECTED
 *   APPROVED|REJECTED|PENDING_REVIEW --SELLER(edit)--> PENDING_REVIEW
 * </pre>
 */
@Component
public class StateRegistry {

    private final List<Edge> orderEdges;
    private final List<Edge> listingEdges;

    public StateRegistry() {
        this.orderEdges = Collections.unmodifiableList(buildOrderEdges());
        this.listingEdges = Collections.unmodifiableList(buildListingEdges());
    }

    public Optional<Edge> find(WorkflowState from, WorkflowState to) {
        return edges(from.kind()).stream()
                .filter(e -> e.getFrom() == from && e.getTo() == to)
                .findFirst();
    }

    public List<Edge> edges(EntityKind kind) {
        return kind == EntityKind.ORDER ? orderEdges : listingEdges;
    }

    public List<WorkflowState> states(EntityKind kind) {
        return kind == EntityKind.ORDER
                ? Arrays.asList(OrderStatus.values())
                : Arrays.asList(ListingStatus.values());
    }

    private static List<Edge> buildOrderEdges() {
        List<Edge> edges = new ArrayList<>();
        Set<SideEffect> notifyParties = EnumSet.of(NOTIFY_ORDER_PARTIES);
        Set<SideEffect> notifyPartiesAndSeller = EnumSet.of(NOTIFY_ORDER_PARTIES, NOTIFY_OWNER);

        edges.add(new Edge(OrderStatus.PLACED, OrderStatus.CONFIRMED, EnumSet.of(BUYER), notifyPartiesAndSeller));

        for (OrderStatus from : List.of(OrderStatus.PLACED, OrderStatus.CONFIRMED)) {
            edges.add(new Edge(from, OrderStatus.ACCEPTED, EnumSet.of(SELLER), notifyParties));
            edges.add(new Edge(from, OrderStatus.REJECTED, EnumSet.of(SELLER), notifyParties));
        }
        for (OrderStatus from : List.of(OrderStatus.PLACED, OrderStatus.CONFIRMED,
                OrderStatus.ACCEPTED, OrderStatus.PACKED)) {
            edges.add(new Edge(from, OrderStatus.CANCELLED, EnumSet.of(BUYER), notifyPartiesAndSeller));
        }

        edges.add(new Edge(OrderStatus.ACCEPTED, OrderStatus.PACKED, EnumSet.of(SELLER), notifyParties));
        edges.add(new Edge(OrderStatus.PACKED, OrderStatus.SHIPPED, EnumSet.of(SELLER), notifyParties));
        edges.add(new Edge(OrderStatus.SHIPPED, OrderStatus.DELIVERED, EnumSet.of(SELLER), notifyParties));
        return edges;
    }

    private static List<Edge> buildListingEdges() {
        List<Edge> edges = new ArrayList<>();

        edges.add(new Edge(ListingStatus.DRAFT, ListingStatus.PENDING_REVIEW, EnumSet.of(SELLER),
                EnumSet.of(INVALIDATE_COUNT, NOTIFY_REVIEWERS)));

        edges.add(new Edge(ListingStatus.PENDING_REVIEW, ListingStatus.APPROVED, EnumSet.of(REVIEWER),
                EnumSet.of(REINDEX, INVALIDATE_COUNT, NOTIFY_OWNER)));
        edges.add(new Edge(ListingStatus.PENDING_REVIEW, ListingStatus.REJECTED, EnumSet.of(REVIEWER),
                EnumSet.of(INVALIDATE_COUNT, NOTIFY_OWNER)));

        // Leaving APPROVED takes the listing out of search and off the featured shelf.
        edges.add(new Edge(ListingStatus.APPROVED, ListingStatus.PENDING_REVIEW, EnumSet.of(SELLER),
                EnumSet.of(REINDEX, UNFEATURE, INVALIDATE_COUNT, NOTIFY_OWNER, NOTIFY_REVIEWERS)));
        edges.add(new Edge(ListingStatus.REJECTED, ListingStatus.PENDING_REVIEW, EnumSet.of(SELLER),
                EnumSet.of(INVALIDATE_COUNT, NOTIFY_OWNER, NOTIFY_REVIEWERS)));
        edges.add(new Edge(ListingStatus.PENDING_REVIEW, ListingStatus.PENDING_REVIEW, EnumSet.of(SELLER),
                EnumSet.of(NOTIFY_REVIEWERS)));
        return edges;
    }

    @Getter
    public static final class Edge {
        private final WorkflowState from;
        private final WorkflowState to;
        private final Set<ActorRole> roles;
        private final Set<SideEffect> effects;

        Edge(WorkflowState from, WorkflowState to, Set<ActorRole> roles, Set<SideEffect> effects) {
            this.from = from;
            this.to = to;
            this.roles = Collections.unmodifiableSet(roles);
            this.effects = Collections.unmodifiableSet(effects);
        }

        public boolean allows(ActorRole role) {
            return roles.contains(role);
        }
    }
}
