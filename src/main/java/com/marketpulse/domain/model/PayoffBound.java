package com.marketpulse.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Max profit or max loss of a position. Either a finite amount, reported per share
 * and for the whole position, or unbounded (long call upside, short call downside).
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PayoffBound {

    private static final PayoffBound UNBOUNDED = new PayoffBound(true, null, null);

    boolean unbounded;
    Double perShare;
    Double total;

    public static PayoffBound of(double perShare, double total) {
        return new PayoffBound(false, perShare, total);
    }

    public static PayoffBound unbounded() {
        return UNBOUNDED;
    }
}
