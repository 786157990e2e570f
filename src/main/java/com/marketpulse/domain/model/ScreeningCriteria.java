package com.marketpulse.domain.model;

import com.marketpulse.domain.enums.ScreenType;
import com.marketpulse.exception.ConfigurationException;
import java.util.Map;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Structural filters for an opportunity screen.
 *
 * <p>Delta bounds are absolute values in [0, 1], oriented by {@link #getScreenType()}
 * (a 0.30 bound matches a +0.30 call or a -0.30 put). Days-to-expiry bounds are
 * inclusive calendar days. {@code topN} and {@code targetDelta} are optional: the
 * screener falls back to its configured cutoff and to the middle of the delta band.
 *
 * @throws ConfigurationException from the builder when a band is empty or inverted
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ScreeningCriteria {

    private final double minDelta;
    private final double maxDelta;
    private final int minDaysToExpiry;
    private final int maxDaysToExpiry;
    private final long minVolume;
    private final long minOpenInterest;
    private final ScreenType screenType;
    private final boolean regimeAware;
    private final Integer topN;
    private final Double targetDelta;

    @Builder(toBuilder = true)
    private ScreeningCriteria(
            double minDelta,
            double maxDelta,
            int minDaysToExpiry,
            int maxDaysToExpiry,
            long minVolume,
            long minOpenInterest,
            ScreenType screenType,
            boolean regimeAware,
            Integer topN,
            Double targetDelta) {
        if (screenType == null) {
            throw new ConfigurationException("Screen type is required");
        }
        if (Double.isNaN(minDelta) || Double.isNaN(maxDelta) || minDelta < 0 || maxDelta > 1) {
            throw new ConfigurationException(
                    "Delta band must lie within [0, 1]", Map.of("minDelta", minDelta, "maxDelta", maxDelta));
        }
        if (minDelta > maxDelta) {
            throw new ConfigurationException(
                    "Delta band is inverted: min > max", Map.of("minDelta", minDelta, "maxDelta", maxDelta));
        }
        if (minDaysToExpiry < 0) {
            throw new ConfigurationException(
                    "Days-to-expiry band must not be negative", Map.of("minDaysToExpiry", minDaysToExpiry));
        }
        if (minDaysToExpiry > maxDaysToExpiry) {
            throw new ConfigurationException(
                    "Days-to-expiry band is inverted: min > max",
                    Map.of("minDaysToExpiry", minDaysToExpiry, "maxDaysToExpiry", maxDaysToExpiry));
        }
        if (minVolume < 0 || minOpenInterest < 0) {
            throw new ConfigurationException(
                    "Liquidity thresholds must not be negative",
                    Map.of("minVolume", minVolume, "minOpenInterest", minOpenInterest));
        }
        if (topN != null && topN <= 0) {
            throw new ConfigurationException("topN must be positive", Map.of("topN", topN));
        }
        if (targetDelta != null && (targetDelta < 0 || targetDelta > 1)) {
            throw new ConfigurationException("targetDelta must lie within [0, 1]", Map.of("targetDelta", targetDelta));
        }

        this.minDelta = minDelta;
        this.maxDelta = maxDelta;
        this.minDaysToExpiry = minDaysToExpiry;
        this.maxDaysToExpiry = maxDaysToExpiry;
        this.minVolume = minVolume;
        this.minOpenInterest = minOpenInterest;
        this.screenType = screenType;
        this.regimeAware = regimeAware;
        this.topN = topN;
        this.targetDelta = targetDelta;
    }

    /** Explicit target delta, else the middle of the delta band. */
    public double effectiveTargetDelta() {
        return targetDelta != null ? targetDelta : (minDelta + maxDelta) / 2.0;
    }

    public boolean acceptsDelta(double delta) {
        double magnitude = Math.abs(delta);
        return magnitude >= minDelta && magnitude <= maxDelta;
    }

    public boolean acceptsDaysToExpiry(long days) {
        return days >= minDaysToExpiry && days <= maxDaysToExpiry;
    }

    public boolean acceptsLiquidity(OptionQuote quote) {
        return quote.getVolume() >= minVolume && quote.getOpenInterest() >= minOpenInterest;
    }
}
