package com.marketpulse.domain.enums;

/**
 * Contract universe slice a screen looks at. OTM calls carry a bullish bias, OTM puts
 * a bearish one; the macro sub-score uses that bias.
 */
public enum ScreenType {
    OTM_CALLS(OptionType.CALL),
    OTM_PUTS(OptionType.PUT);

    private final OptionType optionType;

    ScreenType(OptionType optionType) {
        this.optionType = optionType;
    }

    public OptionType optionType() {
        return optionType;
    }

    /** True when the strike sits on the out-of-the-money side of spot for this screen. */
    public boolean isOutOfTheMoney(double strike, double spot) {
        return optionType.isCall() ? strike > spot : strike < spot;
    }
}
