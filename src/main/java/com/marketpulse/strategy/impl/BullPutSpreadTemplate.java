package com.marketpulse.strategy.impl;

import com.marketpulse.domain.enums.OptionType;
import com.marketpulse.domain.enums.StrategyType;
import org.springframework.stereotype.Component;

/**
 * Short the higher-strike put, long the lower-strike put for a net credit.
 * Breakeven = short strike - credit.
 */
@Component
public class BullPutSpreadTemplate extends AbstractVerticalSpreadTemplate {

    @Override
    public StrategyType getType() {
        return StrategyType.BULL_PUT_SPREAD;
    }

    @Override
    protected OptionType optionType() {
        return OptionType.PUT;
    }

    @Override
    protected boolean isBullish() {
        return true;
    }

    @Override
    protected double breakeven(double longStrike, double shortStrike, double netDebit) {
        // netDebit is negative for a credit
        return shortStrike + netDebit;
    }
}
