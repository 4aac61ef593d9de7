package com.marketplace.order.domain;

import java.util.List;
import java.util.Optional;

/**
 * Durable order storage. Orders are never deleted, so there is no delete primitive.
 * Returned instances are detached.
 */
public interface OrderStore {

    Order create(Order order);

    Optional<Order> findById(String id);

    /**
     * @throws org.springframework.dao.OptimisticLockingFailureException if the order changed
     *         since it was read
     */
    Order update(Order order);

    List<Order> findByBuyer(String buyerId);
}
