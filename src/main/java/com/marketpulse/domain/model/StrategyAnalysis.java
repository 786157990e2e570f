package com.marketpulse.domain.model;

import com.marketpulse.domain.enums.StrategyType;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Net exposure of a composed multi-leg strategy.
 *
 * <p>Sign conventions: {@code netPremium} is the signed sum of premium x quantity over
 * the legs, positive for a net debit and negative for a net credit. {@code netGreeks}
 * is the signed sum of each leg's per-share Greeks x quantity (plus the stock's delta
 * for a covered call, in contract units).
 */
@Value
@Builder
public class StrategyAnalysis {

    StrategyType strategyType;
    String underlying;
    LocalDate expiration;
    long daysToExpiration;

    List<SingleLegAnalysis> legs;

    /** Signed premium x quantity; positive = net debit, negative = net credit. */
    double netPremium;

    /** Absolute cash paid (debit) or received (credit) for the whole position. */
    double totalCost;

    Greeks netGreeks;

    List<Double> breakevens;
    PayoffBound maxProfit;
    PayoffBound maxLoss;
    Double riskRewardRatio;

    /** Max profit as a percentage of max loss, when both are finite. */
    Double maxReturnPct;

    double probabilityOfProfit;

    /** Distance between the two strikes of a vertical spread; null for other shapes. */
    Double spreadWidth;

    List<PayoffPoint> payoffCurve;

    /** Present only for {@link StrategyType#COVERED_CALL}. */
    CoveredCallMetrics coveredCall;
}
