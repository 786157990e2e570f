package com.marketpulse.domain.enums;

/**
 * European option right. Calls pay max(S - K, 0) at expiry, puts pay max(K - S, 0).
 */
public enum OptionType {
    CALL,
    PUT;

    public boolean isCall() {
        return this == CALL;
    }

    /** Payoff at expiration for one unit of the underlying. */
    public double intrinsicValue(double spot, double strike) {
        return isCall() ? Math.max(spot - strike, 0.0) : Math.max(strike - spot, 0.0);
    }
}
