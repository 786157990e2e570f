package com.marketpulse.strategy.impl;

import com.marketpulse.config.AnalysisConfig;
import com.marketpulse.domain.enums.OptionType;
import com.marketpulse.domain.enums.StrategyType;
import com.marketpulse.domain.model.CoveredCallMetrics;
import com.marketpulse.domain.model.MultiLegStrategy;
import com.marketpulse.domain.model.PayoffBound;
import com.marketpulse.domain.model.SingleLegAnalysis;
import com.marketpulse.domain.model.StrategyLeg;
import com.marketpulse.exception.ValidationException;
import com.marketpulse.strategy.StrategyContext;
import com.marketpulse.strategy.StrategyOutcome;
import com.marketpulse.strategy.StrategyTemplate;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Long stock plus one short call per 100 shares.
 *
 * <p>Max profit is the premium plus the stock's gain up to the strike; max loss is the
 * stock going to zero, cushioned by the premium. Shares beyond what the calls cover keep
 * unlimited upside, so the max profit is then unbounded.
 */
@Component
public class CoveredCallTemplate implements StrategyTemplate {

    private final AnalysisConfig analysisConfig;

    public CoveredCallTemplate(AnalysisConfig analysisConfig) {
        this.analysisConfig = analysisConfig;
    }

    @Override
    public StrategyType getType() {
        return StrategyType.COVERED_CALL;
    }

    @Override
    public void validateLegs(MultiLegStrategy strategy) {
        List<StrategyLeg> legs = strategy.getLegs();
        if (legs.size() != 1) {
            throw new ValidationException("legs", legs.size(), "a covered call has exactly one option leg");
        }
        StrategyLeg call = legs.get(0);
        if (call.getContract().getOptionType() != OptionType.CALL || call.isLong()) {
            throw new ValidationException(
                    "legs",
                    call.getDirection() + " " + call.getContract().getOptionType(),
                    "a covered call writes (SHORT) a CALL");
        }
        int sharesNeeded = call.getQuantity() * analysisConfig.getContractMultiplier();
        if (strategy.getSharesHeld() < sharesNeeded) {
            throw new ValidationException(
                    "sharesHeld",
                    strategy.getSharesHeld(),
                    call.getQuantity() + " contract(s) need at least " + sharesNeeded + " shares");
        }
    }

    @Override
    public StrategyOutcome evaluate(StrategyContext context) {
        MultiLegStrategy strategy = context.getStrategy();
        StrategyLeg call = strategy.getLegs().get(0);
        SingleLegAnalysis callAnalysis = context.analysisOf(call);

        int shares = strategy.getSharesHeld();
        int contracts = call.getQuantity();
        double spot = context.getMarket().getSpot();
        if (spot == 0) {
            throw new ValidationException("spot", spot, "covered call returns are relative to a positive stock price");
        }
        double strike = call.getStrike();
        double premium = callAnalysis.getPremium();
        double totalPremium = premium * contracts * context.getMultiplier();
        long days = context.getDaysToExpiration();

        boolean fullyCovered = shares == contracts * context.getMultiplier();
        double maxProfitTotal = totalPremium + (strike - spot) * shares;
        PayoffBound maxProfit = fullyCovered
                ? PayoffBound.of(maxProfitTotal / shares, maxProfitTotal)
                : PayoffBound.unbounded();

        double maxLossTotal = spot * shares - totalPremium;
        PayoffBound maxLoss = PayoffBound.of(maxLossTotal / shares, maxLossTotal);

        double breakeven = spot - totalPremium / shares;
        double returnIfCalledPct = (strike - spot + premium) / spot * 100.0;

        CoveredCallMetrics metrics = CoveredCallMetrics.builder()
                .sharesHeld(shares)
                .contracts(contracts)
                .stockPrice(spot)
                .premiumPerShare(premium)
                .totalPremium(totalPremium)
                .costBasisReduction(premium)
                .downsideProtectionPct(premium / spot * 100.0)
                .upsideCap(strike)
                .returnIfCalledPct(returnIfCalledPct)
                .annualizedReturnPct(days > 0 ? returnIfCalledPct * 365.0 / days : 0.0)
                .probabilityMaxProfit(context.probabilityAbovePct(strike))
                .build();

        return StrategyOutcome.builder()
                .breakevens(List.of(breakeven))
                .maxProfit(maxProfit)
                .maxLoss(maxLoss)
                .probabilityOfProfit(context.probabilityAbovePct(breakeven))
                .spreadWidth(null)
                .coveredCall(metrics)
                .build();
    }

    @Override
    public int stockShares(MultiLegStrategy strategy) {
        return strategy.getSharesHeld();
    }
}
