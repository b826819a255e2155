package com.tradecore.exchange;

import java.math.BigDecimal;
import java.math.RoundingMode;
import lombok.Builder;
import lombok.Value;

/** Trading constraints the exchange enforces for one symbol. */
@Value
@Builder
public class SymbolRules {

    String symbol;

    /** Number of decimal places allowed in a price. */
    int pricePrecision;

    /** Number of decimal places allowed in an amount. */
    int amountPrecision;

    BigDecimal minAmount;
    BigDecimal minNotional;

    /** Rounds toward zero so a rounded buy price never exceeds the unrounded one. */
    public BigDecimal roundPriceDown(BigDecimal price) {
        return price.setScale(pricePrecision, RoundingMode.DOWN);
    }

    public BigDecimal roundAmountDown(BigDecimal amount) {
        return amount.setScale(amountPrecision, RoundingMode.DOWN);
    }

    /**
     * Returns a reason the order would be refused, or null if it satisfies every rule.
     */
    public String violation(BigDecimal price, BigDecimal amount) {
        if (price == null || price.signum() <= 0) {
            return "price must be positive: " + price;
        }
        if (amount == null || amount.signum() <= 0) {
            return "amount must be positive: " + amount;
        }
        if (minAmount != null && amount.compareTo(minAmount) < 0) {
            return String.format("amount %s below minimum %s", amount.toPlainString(), minAmount.toPlainString());
        }
        BigDecimal notional = price.multiply(amount);
        if (minNotional != null && notional.compareTo(minNotional) < 0) {
            return String.format(
                    "notional %s below minimum %s", notional.toPlainString(), minNotional.toPlainString());
        }
        return null;
    }
}
