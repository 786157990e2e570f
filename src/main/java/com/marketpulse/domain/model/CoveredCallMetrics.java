package com.marketpulse.domain.model;

import lombok.Builder;
import lombok.Value;

/** Covered-call specific figures reported alongside the generic strategy analysis. */
@Value
@Builder
public class CoveredCallMetrics {

    int sharesHeld;
    int contracts;
    double stockPrice;

    /** Premium received per share. */
    double premiumPerShare;

    /** Premium received for the whole position. */
    double totalPremium;

    /** Reduction of the stock's cost basis per share; equals the premium per share. */
    double costBasisReduction;

    /** Premium as a percentage of spot: how far the stock can fall before the position loses. */
    double downsideProtectionPct;

    /** Stock price above which gains are capped (the call strike). */
    double upsideCap;

    /** (strike - spot + premium) / spot, in percent. */
    double returnIfCalledPct;

    /** Return if called scaled by 365 / days to expiry, in percent. */
    double annualizedReturnPct;

    /** Risk-neutral probability (0-100) that the stock finishes at or above the strike. */
    double probabilityMaxProfit;
}
