package com.marketplace.order.domain;

import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryOrderStore implements OrderStore {

    private final Map<String, Order> rows = new ConcurrentHashMap<>();

    @Override
    public Order create(Order order) {
        Order row = order.copy();
        row.setVersion(0L);
        row.prePersist();
        rows.put(row.getId(), row);
        return row.copy();
    }

    @Override
    public Optional<Order> findById(String id) {
        return Optional.ofNullable(rows.get(id)).map(Order::copy);
    }

    @Override
    public synchronized Order update(Order order) {
        Order current = rows.get(order.getId());
        if (current == null || !current.getVersion().equals(order.getVersion())) {
            throw new ObjectOptimisticLockingFailureException(Order.class, order.getId());
        }
        Order row = order.copy();
        row.setVersion(current.getVersion() + 1);
        row.preUpdate();
        rows.put(row.getId(), row);
        return row.copy();
    }

    @Override
    public List<Order> findByBuyer(String buyerId) {
        return rows.values().stream()
                .filter(o -> o.getBuyerId().equals(buyerId))
                .sorted(Comparator.comparing(Order::getCreatedAt).reversed())
                .map(Order::copy)
                .toList();
    }
}
