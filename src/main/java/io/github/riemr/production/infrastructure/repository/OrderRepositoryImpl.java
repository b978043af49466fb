package io.github.riemr.production.infrastructure.repository;

import io.github.riemr.production.application.repository.OrderRepository;
import io.github.riemr.production.domain.model.Order;
import io.github.riemr.production.domain.model.OrderStatus;
import io.github.riemr.production.infrastructure.mapper.OrderMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class OrderRepositoryImpl implements OrderRepository {
    private final OrderMapper mapper;

    public OrderRepositoryImpl(OrderMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public Optional<Order> findById(Long orderId) {
        return Optional.ofNullable(mapper.selectByPrimaryKey(orderId));
    }

    @Override
    public List<Order> findOpen() {
        return mapper.selectOpen();
    }

    @Override
    public void updateStatus(Long orderId, OrderStatus status) {
        mapper.updateStatus(orderId, status);
    }
}
