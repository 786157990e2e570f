package com.marketpulse.screener;

import com.marketpulse.analysis.SingleLegAnalyzer;
import com.marketpulse.config.ScreenerConfig;
import com.marketpulse.domain.enums.PositionDirection;
import com.marketpulse.domain.enums.ScreenType;
import com.marketpulse.domain.model.InputChecks;
import com.marketpulse.domain.model.MarketContext;
import com.marketpulse.domain.model.OptionContract;
import com.marketpulse.domain.model.RegimeClassification;
import com.marketpulse.domain.model.ScoreBreakdown;
import com.marketpulse.domain.model.ScoredOpportunity;
import com.marketpulse.domain.model.ScreeningCriteria;
import com.marketpulse.domain.model.ScreeningResult;
import com.marketpulse.domain.model.SingleLegAnalysis;
import com.marketpulse.domain.model.SymbolChain;
import com.marketpulse.exception.DataQualityException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Filters a multi-symbol universe of contracts, scores the survivors and returns a
 * ranked shortlist.
 *
 * <p>Pipeline per symbol:
 * <ol>
 *   <li>Structural filter on the (regime-adjusted) criteria: option type and moneyness of the
 *       screen, DTE band, liquidity thresholds. Contracts without any usable quote are dropped
 *       as data-quality failures</li>
 *   <li>Long single-leg analysis of each survivor, then the |delta| band</li>
 *   <li>Five weighted sub-scores from {@link OpportunityScorer}</li>
 * </ol>
 * Symbols are independent and fan out on the {@code screenerExecutor} pool. The merged
 * list is sorted by score desc, open interest desc, distance to target delta asc, then by
 * symbol, expiration and strike so identical inputs always give an identical order.
 *
 * <p>A data-quality failure only drops that contract. Validation and configuration errors
 * abort the whole screen.
 */
@Slf4j
@Component
public class OpportunityScreener {

    private final SingleLegAnalyzer singleLegAnalyzer;
    private final OpportunityScorer opportunityScorer;
    private final RegimeCriteriaAdjuster regimeCriteriaAdjuster;
    private final ScreenerConfig screenerConfig;
    private final Executor screenerExecutor;

    public OpportunityScreener(
            SingleLegAnalyzer singleLegAnalyzer,
            OpportunityScorer opportunityScorer,
            RegimeCriteriaAdjuster regimeCriteriaAdjuster,
            ScreenerConfig screenerConfig,
            @Qualifier("screenerExecutor") Executor screenerExecutor) {
        this.singleLegAnalyzer = singleLegAnalyzer;
        this.opportunityScorer = opportunityScorer;
        this.regimeCriteriaAdjuster = regimeCriteriaAdjuster;
        this.screenerConfig = screenerConfig;
        this.screenerExecutor = screenerExecutor;
    }

    /** Ranked top-N opportunities; see {@link #run} for the bookkeeping around them. */
    public List<ScoredOpportunity> screen(
            List<SymbolChain> universe, ScreeningCriteria criteria, RegimeClassification regime, LocalDate asof) {
        return run(universe, criteria, regime, asof).getOpportunities();
    }

    /**
     * Screens {@code universe} as of {@code asof}.
     *
     * @param regime optional; drives the band adjustment (when the criteria are regime-aware)
     *     and the macro sub-score
     */
    public ScreeningResult run(
            List<SymbolChain> universe, ScreeningCriteria criteria, RegimeClassification regime, LocalDate asof) {
        InputChecks.requirePresent("universe", universe);
        InputChecks.requirePresent("criteria", criteria);
        InputChecks.requirePresent("asof", asof);

        ScreeningCriteria applied = regimeCriteriaAdjuster.adjust(criteria, regime);

        List<CompletableFuture<SymbolOutcome>> futures = universe.stream()
                .map(chain -> CompletableFuture.supplyAsync(
                        () -> screenSymbol(chain, applied, regime, asof), screenerExecutor))
                .collect(Collectors.toList());

        List<ScoredOpportunity> qualified = new ArrayList<>();
        int evaluated = 0;
        int filtered = 0;
        int dropped = 0;
        for (CompletableFuture<SymbolOutcome> future : futures) {
            SymbolOutcome outcome = join(future);
            qualified.addAll(outcome.opportunities);
            evaluated += outcome.evaluated;
            filtered += outcome.filtered;
            dropped += outcome.dropped;
        }

        qualified.sort(ranking(applied.effectiveTargetDelta()));
        int topN = applied.getTopN() != null ? applied.getTopN() : screenerConfig.getDefaultTopN();
        List<ScoredOpportunity> top = List.copyOf(qualified.subList(0, Math.min(topN, qualified.size())));

        if (dropped > 0) {
            log.warn("Screen dropped {} of {} contracts for missing or unusable quotes", dropped, evaluated);
        }
        log.info(
                "Screened {} symbols ({}): {} evaluated, {} filtered, {} qualified, returning {}",
                universe.size(),
                applied.getScreenType(),
                evaluated,
                filtered,
                qualified.size(),
                top.size());

        return ScreeningResult.builder()
                .opportunities(top)
                .appliedCriteria(applied)
                .regime(regime)
                .contractsEvaluated(evaluated)
                .contractsFiltered(filtered)
                .contractsDropped(dropped)
                .totalQualified(qualified.size())
                .build();
    }

    /** Score descending, then higher open interest, then |delta| nearer the target, then contract identity. */
    public static Comparator<ScoredOpportunity> ranking(double targetDelta) {
        return Comparator.comparingDouble(ScoredOpportunity::getScore)
                .reversed()
                .thenComparing(
                        Comparator.comparingLong((ScoredOpportunity o) ->
                                        o.getContract().getQuote().getOpenInterest())
                                .reversed())
                .thenComparingDouble(o -> Math.abs(Math.abs(o.getAnalysis().getGreeks().getDelta()) - targetDelta))
                .thenComparing(ScoredOpportunity::getSymbol)
                .thenComparing(o -> o.getContract().getExpiration())
                .thenComparingDouble(o -> o.getContract().getStrike());
    }

    private SymbolOutcome screenSymbol(
            SymbolChain chain, ScreeningCriteria criteria, RegimeClassification regime, LocalDate asof) {
        ScreenType screenType = criteria.getScreenType();
        MarketContext market = MarketContext.builder()
                .spot(chain.getSpot())
                .riskFreeRate(chain.getRiskFreeRate())
                .dividendYield(chain.getDividendYield())
                .asof(asof)
                .build();

        SymbolOutcome outcome = new SymbolOutcome();
        for (OptionContract contract : chain.getContracts()) {
            if (contract.getOptionType() != screenType.optionType()) {
                continue;
            }
            outcome.evaluated++;

            if (!screenType.isOutOfTheMoney(contract.getStrike(), chain.getSpot())
                    || !criteria.acceptsDaysToExpiry(contract.daysToExpiration(asof))) {
                outcome.filtered++;
                continue;
            }
            if (contract.getQuote().isUnusable()) {
                log.debug("Dropping {} {} {} {}: no volume, open interest or price",
                        contract.getSymbol(), contract.getExpiration(), contract.getStrike(), contract.getOptionType());
                outcome.dropped++;
                continue;
            }
            if (!criteria.acceptsLiquidity(contract.getQuote())) {
                outcome.filtered++;
                continue;
            }

            SingleLegAnalysis analysis;
            try {
                analysis = singleLegAnalyzer.analyze(contract, PositionDirection.LONG, 1, null, market);
            } catch (DataQualityException e) {
                log.debug("Dropping {} {} {}: {}",
                        contract.getSymbol(), contract.getExpiration(), contract.getStrike(), e.getMessage());
                outcome.dropped++;
                continue;
            }

            if (!criteria.acceptsDelta(analysis.getGreeks().getDelta())) {
                outcome.filtered++;
                continue;
            }

            ScoreBreakdown breakdown = opportunityScorer.score(analysis, chain.getSpot(), screenType, regime);
            outcome.opportunities.add(ScoredOpportunity.builder()
                    .contract(contract)
                    .analysis(analysis)
                    .score(breakdown.getTotal())
                    .breakdown(breakdown)
                    .build());
        }
        return outcome;
    }

    private static SymbolOutcome join(CompletableFuture<SymbolOutcome> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    private static final class SymbolOutcome {
        private final List<ScoredOpportunity> opportunities = new ArrayList<>();
        private int evaluated;
        private int filtered;
        private int dropped;
    }
}
