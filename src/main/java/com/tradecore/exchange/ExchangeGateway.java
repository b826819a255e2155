package com.tradecore.exchange;

import java.math.BigDecimal;

/**
 * Abstraction over the exchange's order API. Every component that places, cancels or queries
 * orders goes through this interface, wrapped in {@link TimeBoundExchangeClient} so that no call
 * can hang a caller.
 *
 * <p>Implementations raise {@link com.tradecore.exception.ExchangeRejectedException} when the
 * exchange refuses a request and {@link com.tradecore.exception.ExchangeException} for transport
 * failures, where the outcome of the request is unknown.
 */
public interface ExchangeGateway {

    /**
     * Places a new order.
     *
     * @param spec the order to place; {@code clientOrderId} is the idempotency key
     * @return the exchange acknowledgement carrying the exchange-assigned id
     */
    OrderAck placeOrder(OrderSpec spec);

    /**
     * Cancels an open order.
     *
     * @param exchangeId the exchange-assigned order id
     * @param symbol     the order's symbol
     */
    CancelAck cancelOrder(String exchangeId, String symbol);

    /**
     * Fetches the current state of an order, including its cumulative filled amount.
     */
    ExchangeOrderStatus fetchOrderStatus(String exchangeId, String symbol);

    /**
     * Fetches the last traded price of {@code symbol}.
     */
    BigDecimal fetchMarketPrice(String symbol);

    /**
     * Fetches the precision and minimum-size rules of {@code symbol}.
     */
    SymbolRules symbolRules(String symbol);
}
