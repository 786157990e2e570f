package com.marketpulse.domain.model;

import static com.marketpulse.domain.model.InputChecks.requireNonNegative;

import com.marketpulse.exception.ValidationException;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Market quote attached to an option contract as supplied by the chain-data provider.
 *
 * <p>Prices are per share. A zero bid/ask/last means "not quoted". The observed implied
 * volatility is optional and, when present, is a decimal (0.25 = 25%).
 */
@Getter
@ToString
@EqualsAndHashCode
public final class OptionQuote {

    public static final OptionQuote EMPTY = OptionQuote.builder().build();

    private final double bid;
    private final double ask;
    private final double last;
    private final long volume;
    private final long openInterest;
    private final Double impliedVolatility;

    @Builder
    private OptionQuote(double bid, double ask, double last, long volume, long openInterest, Double impliedVolatility) {
        this.bid = requireNonNegative("bid", bid);
        this.ask = requireNonNegative("ask", ask);
        this.last = requireNonNegative("last", last);
        if (volume < 0) {
            throw new ValidationException("volume", volume, "must not be negative");
        }
        if (openInterest < 0) {
            throw new ValidationException("openInterest", openInterest, "must not be negative");
        }
        if (impliedVolatility != null) {
            requireNonNegative("impliedVolatility", impliedVolatility);
        }
        this.volume = volume;
        this.openInterest = openInterest;
        this.impliedVolatility = impliedVolatility;
    }

    /**
     * Mid of bid/ask when both sides are quoted, otherwise the last trade.
     *
     * @return the mid price, or null when the contract has no usable price at all
     */
    public Double midPrice() {
        if (bid > 0 && ask > 0) {
            return (bid + ask) / 2.0;
        }
        return last > 0 ? last : null;
    }

    public boolean hasObservedVolatility() {
        return impliedVolatility != null && impliedVolatility > 0;
    }

    /** No trading activity and no price: nothing to score the contract on. */
    public boolean isUnusable() {
        return volume == 0 && openInterest == 0 && midPrice() == null;
    }
}
