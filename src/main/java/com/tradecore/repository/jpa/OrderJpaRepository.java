package com.tradecore.repository.jpa;

import com.tradecore.domain.enums.OrderStatus;
import com.tradecore.entity.OrderEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the recovery copy of orders.
 * Reads happen at startup and in tests; the trading path only ever writes.
 */
@Repository
public interface OrderJpaRepository extends JpaRepository<OrderEntity, String> {

    List<OrderEntity> findByStatus(OrderStatus status);

    List<OrderEntity> findByDealId(String dealId);

    long countByStatus(OrderStatus status);
}
