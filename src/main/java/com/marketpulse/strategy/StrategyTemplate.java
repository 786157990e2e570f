package com.marketpulse.strategy;

import com.marketpulse.domain.enums.StrategyType;
import com.marketpulse.domain.model.MultiLegStrategy;

/**
 * Interprets the legs of one fixed-shape strategy.
 *
 * <p>The composer analyzes every leg and sums net premium, net Greeks and the payoff
 * curve itself; a template only knows its own shape:
 * <ul>
 *   <li>{@link #validateLegs} rejects legs that do not form the strategy, before any pricing</li>
 *   <li>{@link #evaluate} derives breakeven, max profit and max loss analytically</li>
 * </ul>
 *
 * <p>Implementations:
 * <ul>
 *   <li>{@link com.marketpulse.strategy.impl.CoveredCallTemplate}</li>
 *   <li>{@link com.marketpulse.strategy.impl.BullCallSpreadTemplate} and
 *       {@link com.marketpulse.strategy.impl.BearPutSpreadTemplate} (debit verticals)</li>
 *   <li>{@link com.marketpulse.strategy.impl.BullPutSpreadTemplate} and
 *       {@link com.marketpulse.strategy.impl.BearCallSpreadTemplate} (credit verticals)</li>
 * </ul>
 *
 * <p>Resolved by {@link StrategyTemplateFactory} based on {@link StrategyType}.
 */
public interface StrategyTemplate {

    StrategyType getType();

    /**
     * Checks the leg shape: count, option types, directions, strike order, quantities.
     *
     * @throws com.marketpulse.exception.ValidationException if the legs do not form this strategy
     */
    void validateLegs(MultiLegStrategy strategy);

    StrategyOutcome evaluate(StrategyContext context);

    /** Shares of the underlying held alongside the options; they add delta and payoff. */
    default int stockShares(MultiLegStrategy strategy) {
        return 0;
    }
}
