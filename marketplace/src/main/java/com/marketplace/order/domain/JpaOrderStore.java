package com.marketplace.order.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Component;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
interface OrderRepository extends JpaRepository<Order, String> {
    List<Order> findByBuyerIdOrderByCreatedAtDesc(String buyerId);
}

@Component
@RequiredArgsConstructor
class JpaOrderStore implements OrderStore {

    private final OrderRepository repository;

    @Override
    @Transactional
    public Order create(Order order) {
        return repository.save(order);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Order> findById(String id) {
        return repository.findById(id);
    }

    @Override
    @Transactional
    public Order update(Order order) {
        return repository.saveAndFlush(order);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Order> findByBuyer(String buyerId) {
        return repository.findByBuyerIdOrderByCreatedAtDesc(buyerId);
    }
}
