package com.tradecore.repository;

import com.tradecore.domain.enums.OrderStatus;
import com.tradecore.domain.model.Order;
import com.tradecore.domain.model.OrderStatistics;
import java.util.List;
import java.util.Optional;

/**
 * Orders table. Upserts enforce that an exchange id belongs to at most one non-rejected order.
 */
public interface OrdersRepository extends EntityRepository<Order> {

    Optional<Order> findByExchangeId(String exchangeId);

    /** PLACED or PARTIALLY_FILLED orders. */
    List<Order> findOpenOrders();

    List<Order> findOpenBuyOrders();

    List<Order> findByDealId(String dealId);

    List<Order> findBySymbol(String symbol);

    List<Order> findByStatus(OrderStatus status);

    /** The deal's sell order that has not reached the exchange yet (status PENDING), if any. */
    Optional<Order> findPendingSellForDeal(String dealId);

    OrderStatistics statistics();
}
