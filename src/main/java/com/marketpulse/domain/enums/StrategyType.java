package com.marketpulse.domain.enums;

/**
 * Fixed-leg strategy templates supported by the composer. Each type has a dedicated
 * {@link com.marketpulse.strategy.StrategyTemplate} implementation that checks the
 * leg shape and derives breakeven, max profit and max loss analytically.
 */
public enum StrategyType {
    COVERED_CALL,
    BULL_CALL_SPREAD,
    BEAR_PUT_SPREAD,
    BULL_PUT_SPREAD,
    BEAR_CALL_SPREAD
}
