package com.marketpulse.service;

import com.marketpulse.analysis.SingleLegAnalyzer;
import com.marketpulse.core.processor.BlackScholesPricer;
import com.marketpulse.core.processor.IVCalculator;
import com.marketpulse.domain.enums.PositionDirection;
import com.marketpulse.domain.enums.RegimeBasis;
import com.marketpulse.domain.model.ImpliedVolResult;
import com.marketpulse.domain.model.InputChecks;
import com.marketpulse.domain.model.MarketContext;
import com.marketpulse.domain.model.MultiLegStrategy;
import com.marketpulse.domain.model.OptionContract;
import com.marketpulse.domain.model.OptionPrice;
import com.marketpulse.domain.model.PricingInputs;
import com.marketpulse.domain.model.RegimeClassification;
import com.marketpulse.domain.model.ScoredOpportunity;
import com.marketpulse.domain.model.ScreeningCriteria;
import com.marketpulse.domain.model.ScreeningReport;
import com.marketpulse.domain.model.ScreeningResult;
import com.marketpulse.domain.model.SingleLegAnalysis;
import com.marketpulse.domain.model.StrategyAnalysis;
import com.marketpulse.domain.model.SymbolChain;
import com.marketpulse.observability.AnalyticsMetricsService;
import com.marketpulse.regime.RegimeClassifier;
import com.marketpulse.screener.OpportunityScreener;
import com.marketpulse.screener.ScreeningReportGenerator;
import com.marketpulse.strategy.StrategyComposer;
import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for the analytics operations exposed to the API layer.
 *
 * <p>Delegates to the stateless core components and adds what they deliberately leave
 * out: metrics and request-level logging. Nothing is cached between calls.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OptionsAnalyticsService {

    private final BlackScholesPricer blackScholesPricer;
    private final IVCalculator ivCalculator;
    private final SingleLegAnalyzer singleLegAnalyzer;
    private final StrategyComposer strategyComposer;
    private final RegimeClassifier regimeClassifier;
    private final OpportunityScreener opportunityScreener;
    private final ScreeningReportGenerator screeningReportGenerator;
    private final AnalyticsMetricsService analyticsMetricsService;

    /** Theoretical price and Greeks of {@code contract} at volatility {@code volatility}. */
    public OptionPrice price(
            OptionContract contract,
            double spot,
            double riskFreeRate,
            double dividendYield,
            double volatility,
            LocalDate asof) {
        InputChecks.requirePresent("contract", contract);
        PricingInputs inputs =
                PricingInputs.forContract(contract, spot, riskFreeRate, dividendYield, volatility, asof);
        return blackScholesPricer.priceWithGreeks(inputs, contract.getOptionType());
    }

    public ImpliedVolResult solveImpliedVol(
            OptionContract contract,
            double marketPrice,
            double spot,
            double riskFreeRate,
            double dividendYield,
            LocalDate asof) {
        InputChecks.requirePresent("contract", contract);
        PricingInputs inputs = PricingInputs.forContract(contract, spot, riskFreeRate, dividendYield, 0.0, asof);
        ImpliedVolResult result = ivCalculator.solve(marketPrice, inputs, contract.getOptionType());
        if (!result.isConverged()) {
            analyticsMetricsService.recordIvNonConvergence();
        }
        return result;
    }

    public SingleLegAnalysis analyzeSingleLeg(
            OptionContract contract, PositionDirection direction, int contracts, Double premium, MarketContext market) {
        SingleLegAnalysis analysis = singleLegAnalyzer.analyze(contract, direction, contracts, premium, market);
        if (!analysis.isVolatilityConverged()) {
            analyticsMetricsService.recordIvNonConvergence();
        }
        return analysis;
    }

    public StrategyAnalysis composeStrategy(MultiLegStrategy strategy, MarketContext market) {
        StrategyAnalysis analysis = strategyComposer.compose(strategy, market);
        long unconverged = analysis.getLegs().stream()
                .filter(leg -> !leg.isVolatilityConverged())
                .count();
        for (long i = 0; i < unconverged; i++) {
            analyticsMetricsService.recordIvNonConvergence();
        }
        return analysis;
    }

    /**
     * @param basis null to use the configured basis
     */
    public RegimeClassification classifyRegime(double currentLevel, List<Double> history, RegimeBasis basis) {
        return basis == null
                ? regimeClassifier.classify(currentLevel, history)
                : regimeClassifier.classify(currentLevel, history, basis);
    }

    public ScreeningResult screen(
            List<SymbolChain> universe, ScreeningCriteria criteria, RegimeClassification regime, LocalDate asof) {
        ScreeningResult result =
                analyticsMetricsService.timeScreen(() -> opportunityScreener.run(universe, criteria, regime, asof));
        analyticsMetricsService.recordDroppedContracts(result.getContractsDropped());
        return result;
    }

    public ScreeningReport report(List<ScoredOpportunity> opportunities) {
        return screeningReportGenerator.generate(opportunities);
    }
}
