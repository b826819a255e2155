package com.tradecore.repository;

import com.tradecore.domain.enums.DealStatus;
import com.tradecore.domain.model.Deal;
import java.util.List;

/**
 * Deals table.
 *
 * <p>{@link #attachBuyLeg} and {@link #detachBuyLeg} apply the change atomically on the stored
 * row, so two concurrent attaches for the same deal cannot both succeed.
 */
public interface DealsRepository extends EntityRepository<Deal> {

    /** Deals that are not terminal. */
    List<Deal> findActive();

    List<Deal> findBySymbol(String symbol);

    List<Deal> findByStatus(DealStatus status);

    /**
     * @throws com.tradecore.exception.ResourceNotFoundException if the deal does not exist
     * @throws com.tradecore.exception.InvariantViolationException if the deal already has an
     *     open buy leg or is no longer ACTIVE
     */
    Deal attachBuyLeg(String dealId, String orderId);

    /**
     * @throws com.tradecore.exception.ResourceNotFoundException if the deal does not exist
     */
    Deal detachBuyLeg(String dealId);
}
