package com.marketpulse.domain.model;

import static com.marketpulse.domain.model.InputChecks.requireFinite;
import static com.marketpulse.domain.model.InputChecks.requireNonNegative;

import com.marketpulse.exception.ValidationException;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Black-Scholes inputs for one evaluation. Time is in years, rates and volatility are
 * annualized decimals. Everything except the rate must be non-negative; a zero time
 * or zero volatility is valid and produces intrinsic/deterministic behavior.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class PricingInputs {

    /** Calendar-day convention used for T and for theta. */
    public static final double DAYS_PER_YEAR = 365.0;

    private final double spot;
    private final double strike;
    private final double timeToExpiry;
    private final double riskFreeRate;
    private final double dividendYield;
    private final double volatility;

    @Builder(toBuilder = true)
    private PricingInputs(
            double spot,
            double strike,
            double timeToExpiry,
            double riskFreeRate,
            double dividendYield,
            double volatility) {
        this.spot = requireNonNegative("spot", spot);
        this.strike = requireNonNegative("strike", strike);
        if (strike == 0) {
            throw new ValidationException("strike", strike, "must be positive");
        }
        this.timeToExpiry = requireNonNegative("timeToExpiry", timeToExpiry);
        this.riskFreeRate = requireFinite("riskFreeRate", riskFreeRate);
        this.dividendYield = requireNonNegative("dividendYield", dividendYield);
        this.volatility = requireNonNegative("volatility", volatility);
    }

    /**
     * Builds inputs for a contract evaluated on {@code asof}.
     *
     * @throws ValidationException if the contract expired before {@code asof}
     */
    public static PricingInputs forContract(
            OptionContract contract,
            double spot,
            double riskFreeRate,
            double dividendYield,
            double volatility,
            LocalDate asof) {
        return PricingInputs.builder()
                .spot(spot)
                .strike(contract.getStrike())
                .timeToExpiry(yearsToExpiry(asof, contract.getExpiration()))
                .riskFreeRate(riskFreeRate)
                .dividendYield(dividendYield)
                .volatility(volatility)
                .build();
    }

    /**
     * (expiration - asof) / 365. Expiring on {@code asof} gives exactly zero.
     *
     * @throws ValidationException if expiration is before {@code asof}
     */
    public static double yearsToExpiry(LocalDate asof, LocalDate expiration) {
        InputChecks.requirePresent("asof", asof);
        long days = ChronoUnit.DAYS.between(asof, expiration);
        if (days < 0) {
            throw new ValidationException("expiration", expiration, "is before as-of date " + asof);
        }
        return days / DAYS_PER_YEAR;
    }

    public PricingInputs withVolatility(double newVolatility) {
        return toBuilder().volatility(newVolatility).build();
    }

    public boolean isExpired() {
        return timeToExpiry == 0.0;
    }

    /** sigma * sqrt(T), the one-standard-deviation log move to expiry. */
    public double totalVolatility() {
        return volatility * Math.sqrt(timeToExpiry);
    }
}
