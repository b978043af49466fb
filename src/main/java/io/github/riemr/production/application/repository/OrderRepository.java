package io.github.riemr.production.application.repository;

import io.github.riemr.production.domain.model.Order;
import io.github.riemr.production.domain.model.OrderStatus;

import java.util.List;
import java.util.Optional;

public interface OrderRepository {
    Optional<Order> findById(Long orderId);
    /** COMPLETED 以外の受注を納期順で返す。 */
    List<Order> findOpen();
    void updateStatus(Long orderId, OrderStatus status);
}
