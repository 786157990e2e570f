package com.marketpulse.domain.model;

import static com.marketpulse.domain.model.InputChecks.requireFinite;
import static com.marketpulse.domain.model.InputChecks.requireNonNegative;
import static com.marketpulse.domain.model.InputChecks.requirePresent;

import java.time.LocalDate;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Underlying-level market state shared by every leg of an analysis: spot, rate,
 * dividend yield and the caller-supplied as-of date.
 *
 * <p>{@code volatility} is optional. When set it overrides the contract's observed IV;
 * when null the analyzer uses the quote's IV, or solves one from the premium.
 *
 * <p>A spot of zero is accepted, as for {@link PricingInputs}; calls are then worthless and
 * puts are worth their discounted strike. Strategies whose metrics are relative to spot
 * reject it themselves.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class MarketContext {

    private final double spot;
    private final double riskFreeRate;
    private final double dividendYield;
    private final Double volatility;
    private final LocalDate asof;

    @Builder(toBuilder = true)
    private MarketContext(double spot, double riskFreeRate, double dividendYield, Double volatility, LocalDate asof) {
        this.spot = requireNonNegative("spot", spot);
        this.riskFreeRate = requireFinite("riskFreeRate", riskFreeRate);
        this.dividendYield = requireNonNegative("dividendYield", dividendYield);
        if (volatility != null) {
            requireNonNegative("volatility", volatility);
        }
        this.volatility = volatility;
        this.asof = requirePresent("asof", asof);
    }
}
