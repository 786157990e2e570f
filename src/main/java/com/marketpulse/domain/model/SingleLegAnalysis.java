package com.marketpulse.domain.model;

import com.marketpulse.domain.enums.PositionDirection;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Trade-level view of one option position: pricing, Greeks, breakeven, payoff bounds,
 * probability of profit and the expiration payoff curve.
 *
 * <p>Per-share figures use the premium actually paid or collected
 * ({@link #getPremium()}); position totals multiply by contracts times the contract
 * multiplier.
 */
@Value
@Builder
public class SingleLegAnalysis {

    OptionContract contract;
    PositionDirection direction;

    /** Number of contracts. */
    int contracts;

    /** Shares per contract. */
    int multiplier;

    /** Premium per share used for the trade (explicit market price, else quote mid). */
    double premium;

    /** Quote mid, null when the contract is not quoted. */
    Double midPrice;

    double theoreticalPrice;

    /** Volatility the theoretical price and Greeks were evaluated at. */
    double volatility;

    /** False only when the volatility had to be solved and the solver did not converge. */
    boolean volatilityConverged;

    /** Greeks of one long contract, per share. */
    Greeks greeks;

    /** Signed cash flow of opening the position: negative for long (debit), positive for short. */
    double costBasis;

    /** Position theta per day in currency: theta x contracts x multiplier, sign-adjusted. */
    double positionThetaPerDay;

    List<Double> breakevens;
    PayoffBound maxProfit;
    PayoffBound maxLoss;

    /** max profit / max loss when both are finite, else null. */
    Double riskRewardRatio;

    /** Risk-neutral probability (0-100) that the position is in profit at expiration. */
    double probabilityOfProfit;

    long daysToExpiration;
    List<PayoffPoint> payoffCurve;

    /** The single breakeven price every one-option position has. */
    public double getBreakeven() {
        return breakevens.get(0);
    }
}
