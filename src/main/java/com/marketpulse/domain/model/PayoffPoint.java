package com.marketpulse.domain.model;

import lombok.Value;

/** One sample of an expiration payoff curve: position P&L if the underlying ends at {@code spot}. */
@Value(staticConstructor = "of")
public class PayoffPoint {
    double spot;
    double pnl;
}
