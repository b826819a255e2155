package com.tradecore.repository.jpa;

import com.tradecore.domain.enums.DealStatus;
import com.tradecore.entity.DealEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the recovery copy of deals.
 */
@Repository
public interface DealJpaRepository extends JpaRepository<DealEntity, String> {

    List<DealEntity> findByStatus(DealStatus status);
}
