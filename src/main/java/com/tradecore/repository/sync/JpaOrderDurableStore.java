package com.tradecore.repository.sync;

import com.tradecore.domain.model.Order;
import com.tradecore.entity.OrderEntity;
import com.tradecore.exception.RepositoryUnavailableException;
import com.tradecore.mapper.OrderMapper;
import com.tradecore.repository.jpa.OrderJpaRepository;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Orders table in the relational store, through Spring Data JPA.
 */
public class JpaOrderDurableStore implements DurableStore<Order> {

    private final OrderJpaRepository orderJpaRepository;
    private final TransactionTemplate transactionTemplate;
    private final OrderMapper orderMapper = Mappers.getMapper(OrderMapper.class);

    public JpaOrderDurableStore(OrderJpaRepository orderJpaRepository, TransactionTemplate transactionTemplate) {
        this.orderJpaRepository = orderJpaRepository;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public void ping() {
        try {
            orderJpaRepository.count();
        } catch (DataAccessException | TransactionException e) {
            throw new RepositoryUnavailableException("Orders store unreachable: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Order> loadAll() {
        try {
            return orderMapper.toDomainList(orderJpaRepository.findAll());
        } catch (DataAccessException | TransactionException e) {
            throw new RepositoryUnavailableException("Failed to load orders: " + e.getMessage(), e);
        }
    }

    @Override
    public void upsert(Order order) {
        try {
            orderJpaRepository.save(orderMapper.toEntity(order));
        } catch (DataAccessException | TransactionException e) {
            throw new RepositoryUnavailableException("Failed to save order " + order.getId(), e);
        }
    }

    @Override
    public void delete(String id) {
        try {
            orderJpaRepository.deleteById(id);
        } catch (DataAccessException | TransactionException e) {
            throw new RepositoryUnavailableException("Failed to delete order " + id, e);
        }
    }

    @Override
    public void replaceAll(Collection<Order> orders) {
        List<OrderEntity> entities = orderMapper.toEntityList(new ArrayList<>(orders));
        try {
            transactionTemplate.executeWithoutResult(status -> {
                orderJpaRepository.deleteAllInBatch();
                orderJpaRepository.saveAll(entities);
            });
        } catch (DataAccessException | TransactionException e) {
            throw new RepositoryUnavailableException("Failed to replace orders table: " + e.getMessage(), e);
        }
    }
}
