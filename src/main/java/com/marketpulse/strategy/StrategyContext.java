package com.marketpulse.strategy;

import com.marketpulse.core.processor.BlackScholesPricer;
import com.marketpulse.domain.model.MarketContext;
import com.marketpulse.domain.model.MultiLegStrategy;
import com.marketpulse.domain.model.PricingInputs;
import com.marketpulse.domain.model.SingleLegAnalysis;
import com.marketpulse.domain.model.StrategyLeg;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Everything a {@link StrategyTemplate} needs to evaluate a strategy: the legs in input
 * order with their single-leg analyses, the market, and the underlying distribution
 * used for probabilities.
 */
@Value
@Builder
public class StrategyContext {

    MultiLegStrategy strategy;

    /** Analyses of {@code strategy.getLegs()}, same order. */
    List<SingleLegAnalysis> legAnalyses;

    MarketContext market;
    int multiplier;

    /** Signed premium per unit of quantity: positive = net debit. */
    double netPremium;

    /** Underlying distribution (spot, T, r, q, reference volatility) for probabilities. */
    PricingInputs referenceInputs;

    BlackScholesPricer pricer;

    public long getDaysToExpiration() {
        return legAnalyses.get(0).getDaysToExpiration();
    }

    public SingleLegAnalysis analysisOf(StrategyLeg leg) {
        return legAnalyses.get(strategy.getLegs().indexOf(leg));
    }

    /** Risk-neutral probability, 0-100, that the underlying finishes above {@code level}. */
    public double probabilityAbovePct(double level) {
        return pricer.probabilityAbove(referenceInputs, level) * 100.0;
    }

    public double probabilityBelowPct(double level) {
        return pricer.probabilityBelow(referenceInputs, level) * 100.0;
    }
}
