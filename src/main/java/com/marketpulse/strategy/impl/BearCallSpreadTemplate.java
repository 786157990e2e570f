package com.marketpulse.strategy.impl;

import com.marketpulse.domain.enums.OptionType;
import com.marketpulse.domain.enums.StrategyType;
import org.springframework.stereotype.Component;

/**
 * Short the lower-strike call, long the higher-strike call for a net credit.
 * Breakeven = short strike + credit.
 */
@Component
public class BearCallSpreadTemplate extends AbstractVerticalSpreadTemplate {

    @Override
    public StrategyType getType() {
        return StrategyType.BEAR_CALL_SPREAD;
    }

    @Override
    protected OptionType optionType() {
        return OptionType.CALL;
    }

    @Override
    protected boolean isBullish() {
        return false;
    }

    @Override
    protected double breakeven(double longStrike, double shortStrike, double netDebit) {
        return shortStrike - netDebit;
    }
}
