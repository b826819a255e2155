package com.tradecore.config;

import com.tradecore.repository.jpa.DealJpaRepository;
import com.tradecore.repository.jpa.OrderJpaRepository;
import com.tradecore.repository.sync.JpaDealDurableStore;
import com.tradecore.repository.sync.JpaOrderDurableStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Relational stores backing the write-through repositories.
 */
@Configuration
public class DurableStoreConfig {

    @Bean
    public JpaOrderDurableStore orderDurableStore(
            OrderJpaRepository orderJpaRepository, PlatformTransactionManager transactionManager) {
        return new JpaOrderDurableStore(orderJpaRepository, new TransactionTemplate(transactionManager));
    }

    @Bean
    public JpaDealDurableStore dealDurableStore(
            DealJpaRepository dealJpaRepository, PlatformTransactionManager transactionManager) {
        return new JpaDealDurableStore(dealJpaRepository, new TransactionTemplate(transactionManager));
    }
}
