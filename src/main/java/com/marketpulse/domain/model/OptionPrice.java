package com.marketpulse.domain.model;

import com.marketpulse.domain.enums.OptionType;
import lombok.Builder;
import lombok.Value;

/** Theoretical price and Greeks for one contract, with the inputs that produced them. */
@Value
@Builder
public class OptionPrice {

    OptionType optionType;
    double price;
    double intrinsicValue;

    /** price - intrinsic value; the time value left in the option. */
    double extrinsicValue;

    Greeks greeks;
    PricingInputs inputs;
}
