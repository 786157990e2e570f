package com.marketpulse.strategy.impl;

import com.marketpulse.domain.enums.OptionType;
import com.marketpulse.domain.enums.StrategyType;
import org.springframework.stereotype.Component;

/**
 * Long the higher-strike put, short the lower-strike put. Breakeven = long strike - net debit.
 */
@Component
public class BearPutSpreadTemplate extends AbstractVerticalSpreadTemplate {

    @Override
    public StrategyType getType() {
        return StrategyType.BEAR_PUT_SPREAD;
    }

    @Override
    protected OptionType optionType() {
        return OptionType.PUT;
    }

    @Override
    protected boolean isBullish() {
        return false;
    }

    @Override
    protected double breakeven(double longStrike, double shortStrike, double netDebit) {
        return longStrike - netDebit;
    }
}
