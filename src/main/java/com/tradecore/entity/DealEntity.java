package com.tradecore.entity;

import com.tradecore.domain.enums.DealStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the deals table.
 */
@Entity
@Table(name = "deals")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DealEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(length = 30)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(20)")
    private DealStatus status;

    @Column(name = "buy_order_id", length = 36)
    private String buyOrderId;

    @Column(name = "sell_order_id", length = 36)
    private String sellOrderId;

    @Column(name = "target_profit_percent", precision = 20, scale = 8)
    private BigDecimal targetProfitPercent;

    @Column(name = "realized_profit", precision = 38, scale = 18)
    private BigDecimal realizedProfit;

    @Column(name = "created_at")
    private long createdAt;

    @Column(name = "completed_at")
    private long completedAt;

    @Column(name = "failure_reason", length = 500)
    private String failureReason;
}
