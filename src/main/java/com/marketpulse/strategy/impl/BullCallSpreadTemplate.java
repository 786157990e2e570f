package com.marketpulse.strategy.impl;

import com.marketpulse.domain.enums.OptionType;
import com.marketpulse.domain.enums.StrategyType;
import org.springframework.stereotype.Component;

/**
 * Long the lower-strike call, short the higher-strike call. Paid for up front;
 * breakeven = long strike + net debit.
 */
@Component
public class BullCallSpreadTemplate extends AbstractVerticalSpreadTemplate {

    @Override
    public StrategyType getType() {
        return StrategyType.BULL_CALL_SPREAD;
    }

    @Override
    protected OptionType optionType() {
        return OptionType.CALL;
    }

    @Override
    protected boolean isBullish() {
        return true;
    }

    @Override
    protected double breakeven(double longStrike, double shortStrike, double netDebit) {
        return longStrike + netDebit;
    }
}
