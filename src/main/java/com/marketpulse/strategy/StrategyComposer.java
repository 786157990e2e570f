package com.marketpulse.strategy;

import com.marketpulse.analysis.PayoffGrid;
import com.marketpulse.analysis.SingleLegAnalyzer;
import com.marketpulse.config.AnalysisConfig;
import com.marketpulse.core.processor.BlackScholesPricer;
import com.marketpulse.domain.model.Greeks;
import com.marketpulse.domain.model.InputChecks;
import com.marketpulse.domain.model.MarketContext;
import com.marketpulse.domain.model.MultiLegStrategy;
import com.marketpulse.domain.model.PayoffPoint;
import com.marketpulse.domain.model.PricingInputs;
import com.marketpulse.domain.model.SingleLegAnalysis;
import com.marketpulse.domain.model.StrategyAnalysis;
import com.marketpulse.domain.model.StrategyLeg;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Combines the legs of a {@link MultiLegStrategy} into net exposure.
 *
 * <p>Flow:
 * <ol>
 *   <li>Resolve the template for the strategy type and validate the leg shape</li>
 *   <li>Analyze every leg with {@link SingleLegAnalyzer}</li>
 *   <li>Net premium = sum(sign x premium x quantity); net Greeks = sum(sign x quantity x Greeks),
 *       plus shares / multiplier of delta for any stock held</li>
 *   <li>Breakevens, max profit and max loss come from the template</li>
 *   <li>Payoff curve sums every leg (and the stock) at expiration</li>
 * </ol>
 *
 * <p>Probabilities use the volatility of the first long leg (the first leg if none is long)
 * as the underlying's volatility.
 */
@Slf4j
@Component
public class StrategyComposer {

    private final StrategyTemplateFactory strategyTemplateFactory;
    private final SingleLegAnalyzer singleLegAnalyzer;
    private final BlackScholesPricer pricer;
    private final AnalysisConfig analysisConfig;

    public StrategyComposer(
            StrategyTemplateFactory strategyTemplateFactory,
            SingleLegAnalyzer singleLegAnalyzer,
            BlackScholesPricer pricer,
            AnalysisConfig analysisConfig) {
        this.strategyTemplateFactory = strategyTemplateFactory;
        this.singleLegAnalyzer = singleLegAnalyzer;
        this.pricer = pricer;
        this.analysisConfig = analysisConfig;
    }

    public StrategyAnalysis compose(MultiLegStrategy strategy, MarketContext market) {
        InputChecks.requirePresent("strategy", strategy);
        InputChecks.requirePresent("market", market);

        StrategyTemplate template = strategyTemplateFactory.getTemplate(strategy.getStrategyType());
        template.validateLegs(strategy);

        List<SingleLegAnalysis> legAnalyses = new ArrayList<>();
        double netPremium = 0.0;
        Greeks netGreeks = Greeks.ZERO;
        for (StrategyLeg leg : strategy.getLegs()) {
            SingleLegAnalysis analysis = singleLegAnalyzer.analyze(
                    leg.getContract(), leg.getDirection(), leg.getQuantity(), leg.getPremium(), market);
            legAnalyses.add(analysis);

            int signedQuantity = leg.getDirection().sign() * leg.getQuantity();
            netPremium += signedQuantity * analysis.getPremium();
            netGreeks = netGreeks.plus(analysis.getGreeks().scaled(signedQuantity));
        }

        int multiplier = analysisConfig.getContractMultiplier();
        int stockShares = template.stockShares(strategy);
        if (stockShares > 0) {
            netGreeks = netGreeks.plus(Greeks.builder()
                    .delta((double) stockShares / multiplier)
                    .gamma(0)
                    .theta(0)
                    .vega(0)
                    .rho(0)
                    .build());
        }

        PricingInputs referenceInputs = referenceInputs(strategy, legAnalyses, market);
        StrategyContext context = StrategyContext.builder()
                .strategy(strategy)
                .legAnalyses(List.copyOf(legAnalyses))
                .market(market)
                .multiplier(multiplier)
                .netPremium(netPremium)
                .referenceInputs(referenceInputs)
                .pricer(pricer)
                .build();
        StrategyOutcome outcome = template.evaluate(context);

        List<PayoffPoint> payoffCurve =
                payoffCurve(strategy, legAnalyses, outcome, stockShares, market, referenceInputs.totalVolatility());

        Double riskReward = SingleLegAnalyzer.riskReward(outcome.getMaxProfit(), outcome.getMaxLoss());
        StrategyAnalysis result = StrategyAnalysis.builder()
                .strategyType(strategy.getStrategyType())
                .underlying(strategy.getUnderlying())
                .expiration(strategy.getExpiration())
                .daysToExpiration(context.getDaysToExpiration())
                .legs(List.copyOf(legAnalyses))
                .netPremium(netPremium)
                .totalCost(Math.abs(netPremium) * multiplier)
                .netGreeks(netGreeks)
                .breakevens(outcome.getBreakevens())
                .maxProfit(outcome.getMaxProfit())
                .maxLoss(outcome.getMaxLoss())
                .riskRewardRatio(riskReward)
                .maxReturnPct(riskReward != null ? riskReward * 100.0 : null)
                .probabilityOfProfit(outcome.getProbabilityOfProfit())
                .spreadWidth(outcome.getSpreadWidth())
                .payoffCurve(payoffCurve)
                .coveredCall(outcome.getCoveredCall())
                .build();

        log.debug(
                "Composed {} on {} exp {}: net premium {}, breakevens {}",
                result.getStrategyType(),
                result.getUnderlying(),
                result.getExpiration(),
                netPremium,
                result.getBreakevens());
        return result;
    }

    private PricingInputs referenceInputs(
            MultiLegStrategy strategy, List<SingleLegAnalysis> legAnalyses, MarketContext market) {
        int reference = 0;
        for (int i = 0; i < strategy.getLegs().size(); i++) {
            if (strategy.getLegs().get(i).isLong()) {
                reference = i;
                break;
            }
        }
        SingleLegAnalysis referenceLeg = legAnalyses.get(reference);
        return PricingInputs.forContract(
                referenceLeg.getContract(),
                market.getSpot(),
                market.getRiskFreeRate(),
                market.getDividendYield(),
                referenceLeg.getVolatility(),
                market.getAsof());
    }

    private List<PayoffPoint> payoffCurve(
            MultiLegStrategy strategy,
            List<SingleLegAnalysis> legAnalyses,
            StrategyOutcome outcome,
            int stockShares,
            MarketContext market,
            double totalVolatility) {
        List<Double> anchors = new ArrayList<>();
        strategy.getLegs().forEach(leg -> anchors.add(leg.getStrike()));
        anchors.addAll(outcome.getBreakevens());
        double[] anchorArray = anchors.stream().mapToDouble(Double::doubleValue).toArray();

        return PayoffGrid.spots(market.getSpot(), totalVolatility, analysisConfig, anchorArray).stream()
                .map(s -> {
                    double pnl = stockShares * (s - market.getSpot());
                    for (SingleLegAnalysis leg : legAnalyses) {
                        pnl += singleLegAnalyzer.pnlAtExpiration(leg, s);
                    }
                    return PayoffPoint.of(s, pnl);
                })
                .collect(Collectors.toList());
    }
}
