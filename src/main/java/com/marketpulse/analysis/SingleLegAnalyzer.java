package com.marketpulse.analysis;

import com.marketpulse.config.AnalysisConfig;
import com.marketpulse.core.processor.BlackScholesPricer;
import com.marketpulse.core.processor.IVCalculator;
import com.marketpulse.domain.enums.OptionType;
import com.marketpulse.domain.enums.PositionDirection;
import com.marketpulse.domain.model.ImpliedVolResult;
import com.marketpulse.domain.model.InputChecks;
import com.marketpulse.domain.model.MarketContext;
import com.marketpulse.domain.model.OptionContract;
import com.marketpulse.domain.model.OptionPrice;
import com.marketpulse.domain.model.PayoffBound;
import com.marketpulse.domain.model.PayoffPoint;
import com.marketpulse.domain.model.PricingInputs;
import com.marketpulse.domain.model.SingleLegAnalysis;
import com.marketpulse.exception.DataQualityException;
import com.marketpulse.exception.ValidationException;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Trade-level risk metrics for a position in a single option.
 *
 * <p>Breakeven is strike + premium for calls and strike - premium for puts, for either
 * direction. Long calls have unbounded max profit and short calls unbounded max loss;
 * puts are bounded by the underlying's floor at zero.
 *
 * <p>Probability of profit is the risk-neutral probability N(d2) that the underlying
 * finishes on the profitable side of the breakeven. It is not delta: the two diverge
 * away from the money.
 *
 * <p>Volatility used for pricing, in order of precedence: the caller's override on
 * {@link MarketContext}, the quote's observed IV, then IV solved from the premium.
 */
@Slf4j
@Component
public class SingleLegAnalyzer {

    private final BlackScholesPricer pricer;
    private final IVCalculator ivCalculator;
    private final AnalysisConfig analysisConfig;

    public SingleLegAnalyzer(BlackScholesPricer pricer, IVCalculator ivCalculator, AnalysisConfig analysisConfig) {
        this.pricer = pricer;
        this.ivCalculator = ivCalculator;
        this.analysisConfig = analysisConfig;
    }

    /**
     * Analyzes {@code contracts} contracts of {@code contract} held in {@code direction}.
     *
     * @param premium per-share price paid or collected; null to use the quote mid
     * @throws ValidationException  on a non-positive contract count or a contract that expired before as-of
     * @throws DataQualityException when no premium is given and the quote has no usable price
     */
    public SingleLegAnalysis analyze(
            OptionContract contract,
            PositionDirection direction,
            int contracts,
            Double premium,
            MarketContext market) {
        InputChecks.requirePresent("contract", contract);
        InputChecks.requirePresent("direction", direction);
        InputChecks.requirePresent("market", market);
        if (contracts <= 0) {
            throw new ValidationException("contracts", contracts, "must be positive");
        }

        Double midPrice = contract.getQuote().midPrice();
        double premiumUsed = resolvePremium(contract, premium, midPrice);

        PricingInputs unpriced = PricingInputs.forContract(
                contract,
                market.getSpot(),
                market.getRiskFreeRate(),
                market.getDividendYield(),
                0.0,
                market.getAsof());

        double volatility;
        boolean volatilityConverged = true;
        if (market.getVolatility() != null) {
            volatility = market.getVolatility();
        } else if (contract.getQuote().hasObservedVolatility()) {
            volatility = contract.getQuote().getImpliedVolatility();
        } else {
            ImpliedVolResult solved = ivCalculator.solve(premiumUsed, unpriced, contract.getOptionType());
            volatility = solved.getVolatility();
            volatilityConverged = solved.isConverged();
            if (!volatilityConverged) {
                log.debug(
                        "Using unconverged IV {} for {} {} {} ({})",
                        volatility,
                        contract.getSymbol(),
                        contract.getStrike(),
                        contract.getOptionType(),
                        solved.getMessage());
            }
        }

        PricingInputs inputs = unpriced.withVolatility(volatility);
        OptionPrice theoretical = pricer.priceWithGreeks(inputs, contract.getOptionType());

        int multiplier = analysisConfig.getContractMultiplier();
        double positionSize = (double) contracts * multiplier;
        int sign = direction.sign();

        double strike = contract.getStrike();
        boolean isCall = contract.getOptionType().isCall();
        double breakeven = isCall ? strike + premiumUsed : strike - premiumUsed;

        PayoffBound maxProfit;
        PayoffBound maxLoss;
        if (isCall) {
            PayoffBound premiumBound = PayoffBound.of(premiumUsed, premiumUsed * positionSize);
            maxProfit = direction == PositionDirection.LONG ? PayoffBound.unbounded() : premiumBound;
            maxLoss = direction == PositionDirection.LONG ? premiumBound : PayoffBound.unbounded();
        } else {
            double floorValue = Math.max(0.0, strike - premiumUsed);
            PayoffBound premiumBound = PayoffBound.of(premiumUsed, premiumUsed * positionSize);
            PayoffBound floorBound = PayoffBound.of(floorValue, floorValue * positionSize);
            maxProfit = direction == PositionDirection.LONG ? floorBound : premiumBound;
            maxLoss = direction == PositionDirection.LONG ? premiumBound : floorBound;
        }

        // Long calls and short puts win above the breakeven, the other two below it
        boolean profitAbove = isCall == (direction == PositionDirection.LONG);
        double probability = profitAbove
                ? pricer.probabilityAbove(inputs, breakeven)
                : pricer.probabilityBelow(inputs, breakeven);

        List<PayoffPoint> curve = PayoffGrid.spots(
                        market.getSpot(), inputs.totalVolatility(), analysisConfig, strike, breakeven)
                .stream()
                .map(s -> PayoffPoint.of(
                        s,
                        pnlAtExpiration(contract.getOptionType(), direction, strike, premiumUsed, positionSize, s)))
                .collect(Collectors.toList());

        return SingleLegAnalysis.builder()
                .contract(contract)
                .direction(direction)
                .contracts(contracts)
                .multiplier(multiplier)
                .premium(premiumUsed)
                .midPrice(midPrice)
                .theoreticalPrice(theoretical.getPrice())
                .volatility(volatility)
                .volatilityConverged(volatilityConverged)
                .greeks(theoretical.getGreeks())
                .costBasis(-sign * premiumUsed * positionSize)
                .positionThetaPerDay(sign * theoretical.getGreeks().getTheta() * positionSize)
                .breakevens(List.of(breakeven))
                .maxProfit(maxProfit)
                .maxLoss(maxLoss)
                .riskRewardRatio(riskReward(maxProfit, maxLoss))
                .probabilityOfProfit(probability * 100.0)
                .daysToExpiration(contract.daysToExpiration(market.getAsof()))
                .payoffCurve(curve)
                .build();
    }

    /** Position P&L, in currency, if the underlying settles at {@code spotAtExpiry}. */
    public double pnlAtExpiration(SingleLegAnalysis analysis, double spotAtExpiry) {
        return pnlAtExpiration(
                analysis.getContract().getOptionType(),
                analysis.getDirection(),
                analysis.getContract().getStrike(),
                analysis.getPremium(),
                (double) analysis.getContracts() * analysis.getMultiplier(),
                spotAtExpiry);
    }

    private static double pnlAtExpiration(
            OptionType type,
            PositionDirection direction,
            double strike,
            double premium,
            double positionSize,
            double spotAtExpiry) {
        return direction.sign() * (type.intrinsicValue(spotAtExpiry, strike) - premium) * positionSize;
    }

    /** max profit / max loss when both are finite and the loss is positive. */
    public static Double riskReward(PayoffBound maxProfit, PayoffBound maxLoss) {
        if (maxProfit.isUnbounded() || maxLoss.isUnbounded() || maxLoss.getTotal() <= 0) {
            return null;
        }
        return maxProfit.getTotal() / maxLoss.getTotal();
    }

    private static double resolvePremium(OptionContract contract, Double premium, Double midPrice) {
        if (premium != null) {
            return InputChecks.requireNonNegative("premium", premium);
        }
        if (midPrice == null) {
            throw new DataQualityException(
                    "No premium for " + contract.getSymbol() + " " + contract.getStrike() + " "
                            + contract.getOptionType() + ": quote has no bid/ask or last price",
                    Map.of(
                            "symbol", contract.getSymbol(),
                            "strike", contract.getStrike(),
                            "expiration", contract.getExpiration().toString()));
        }
        return midPrice;
    }
}
