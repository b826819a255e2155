package com.tradecore.repository.sync;

import com.tradecore.domain.model.Deal;
import com.tradecore.entity.DealEntity;
import com.tradecore.exception.RepositoryUnavailableException;
import com.tradecore.mapper.DealMapper;
import com.tradecore.repository.jpa.DealJpaRepository;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Deals table in the relational store, through Spring Data JPA.
 */
public class JpaDealDurableStore implements DurableStore<Deal> {

    private final DealJpaRepository dealJpaRepository;
    private final TransactionTemplate transactionTemplate;
    private final DealMapper dealMapper = Mappers.getMapper(DealMapper.class);

    public JpaDealDurableStore(DealJpaRepository dealJpaRepository, TransactionTemplate transactionTemplate) {
        this.dealJpaRepository = dealJpaRepository;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public void ping() {
        try {
            dealJpaRepository.count();
        } catch (DataAccessException | TransactionException e) {
            throw new RepositoryUnavailableException("Deals store unreachable: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Deal> loadAll() {
        try {
            return dealMapper.toDomainList(dealJpaRepository.findAll());
        } catch (DataAccessException | TransactionException e) {
            throw new RepositoryUnavailableException("Failed to load deals: " + e.getMessage(), e);
        }
    }

    @Override
    public void upsert(Deal deal) {
        try {
            dealJpaRepository.save(dealMapper.toEntity(deal));
        } catch (DataAccessException | TransactionException e) {
            throw new RepositoryUnavailableException("Failed to save deal " + deal.getId(), e);
        }
    }

    @Override
    public void delete(String id) {
        try {
            dealJpaRepository.deleteById(id);
        } catch (DataAccessException | TransactionException e) {
            throw new RepositoryUnavailableException("Failed to delete deal " + id, e);
        }
    }

    @Override
    public void replaceAll(Collection<Deal> deals) {
        List<DealEntity> entities = dealMapper.toEntityList(new ArrayList<>(deals));
        try {
            transactionTemplate.executeWithoutResult(status -> {
                dealJpaRepository.deleteAllInBatch();
                dealJpaRepository.saveAll(entities);
            });
        } catch (DataAccessException | TransactionException e) {
            throw new RepositoryUnavailableException("Failed to replace deals table: " + e.getMessage(), e);
        }
    }
}
