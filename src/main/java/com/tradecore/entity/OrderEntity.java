package com.tradecore.entity;

import com.tradecore.domain.enums.OrderSide;
import com.tradecore.domain.enums.OrderStatus;
import com.tradecore.domain.enums.OrderType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the orders table.
 * The in-memory table is the primary store; this row is the recovery copy.
 */
@Entity
@Table(
        name = "orders",
        indexes = {
            @Index(name = "idx_orders_exchange_id", columnList = "exchange_id"),
            @Index(name = "idx_orders_deal_id", columnList = "deal_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "exchange_id", length = 100)
    private String exchangeId;

    @Column(name = "client_order_id", length = 64)
    private String clientOrderId;

    @Column(length = 30)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private OrderSide side;

    @Enumerated(EnumType.STRING)
    @Column(name = "order_type", columnDefinition = "varchar(20)")
    private OrderType orderType;

    @Column(precision = 38, scale = 18)
    private BigDecimal price;

    @Column(name = "requested_amount", precision = 38, scale = 18)
    private BigDecimal requestedAmount;

    @Column(name = "filled_amount", precision = 38, scale = 18)
    private BigDecimal filledAmount;

    @Column(name = "average_fill_price", precision = 38, scale = 18)
    private BigDecimal averageFillPrice;

    @Column(precision = 38, scale = 18)
    private BigDecimal fees;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(20)")
    private OrderStatus status;

    @Column(name = "deal_id", length = 36)
    private String dealId;

    @Column(name = "replaces_order_id", length = 36)
    private String replacesOrderId;

    @Column(name = "created_at")
    private long createdAt;

    @Column(name = "last_updated_at")
    private long lastUpdatedAt;

    @Column(name = "retry_count")
    private int retryCount;

    @Column(name = "last_error", length = 500)
    private String lastError;
}
