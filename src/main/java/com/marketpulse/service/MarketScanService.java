package com.marketpulse.service;

import com.marketpulse.config.MarketDataConfig;
import com.marketpulse.domain.model.InputChecks;
import com.marketpulse.domain.model.MarketScanResult;
import com.marketpulse.domain.model.OptionContract;
import com.marketpulse.domain.model.RegimeClassification;
import com.marketpulse.domain.model.ScreeningCriteria;
import com.marketpulse.domain.model.ScreeningResult;
import com.marketpulse.domain.model.SymbolChain;
import com.marketpulse.exception.MarketDataUnavailableException;
import com.marketpulse.marketdata.ChainDataProvider;
import com.marketpulse.marketdata.DividendYieldProvider;
import com.marketpulse.marketdata.IndexHistoryProvider;
import com.marketpulse.marketdata.RiskFreeRateProvider;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Screens a list of symbols end to end: loads chains through the market-data providers,
 * classifies the volatility regime when the criteria are regime-aware, then runs the
 * opportunity screen.
 *
 * <p>All I/O happens here, before the math core is called. Chain loading fans out per
 * symbol on the {@code screenerExecutor}; a symbol whose data cannot be loaded is logged
 * and skipped rather than failing the scan. A missing regime (no history provider, or a
 * failed history fetch) degrades to an unadjusted screen with a neutral macro score.
 *
 * <p>Chain and history providers are optional beans: this project ships none, the
 * deployment supplies them.
 */
@Slf4j
@Service
public class MarketScanService {

    private final ObjectProvider<ChainDataProvider> chainDataProvider;
    private final ObjectProvider<IndexHistoryProvider> indexHistoryProvider;
    private final RiskFreeRateProvider riskFreeRateProvider;
    private final DividendYieldProvider dividendYieldProvider;
    private final OptionsAnalyticsService optionsAnalyticsService;
    private final MarketDataConfig marketDataConfig;
    private final Executor screenerExecutor;

    public MarketScanService(
            ObjectProvider<ChainDataProvider> chainDataProvider,
            ObjectProvider<IndexHistoryProvider> indexHistoryProvider,
            RiskFreeRateProvider riskFreeRateProvider,
            DividendYieldProvider dividendYieldProvider,
            OptionsAnalyticsService optionsAnalyticsService,
            MarketDataConfig marketDataConfig,
            @Qualifier("screenerExecutor") Executor screenerExecutor) {
        this.chainDataProvider = chainDataProvider;
        this.indexHistoryProvider = indexHistoryProvider;
        this.riskFreeRateProvider = riskFreeRateProvider;
        this.dividendYieldProvider = dividendYieldProvider;
        this.optionsAnalyticsService = optionsAnalyticsService;
        this.marketDataConfig = marketDataConfig;
        this.screenerExecutor = screenerExecutor;
    }

    /**
     * Scans with fixed criteria. The regime is loaded only when the criteria are regime-aware.
     *
     * @throws MarketDataUnavailableException if no chain provider is configured
     */
    public MarketScanResult scan(List<String> symbols, ScreeningCriteria criteria, LocalDate asof) {
        InputChecks.requirePresent("criteria", criteria);
        ChainDataProvider chains = requireChainProvider();
        RegimeClassification regime = criteria.isRegimeAware() ? currentRegime().orElse(null) : null;
        return scan(chains, symbols, criteria, regime, asof);
    }

    /**
     * Scans with a regime the caller already loaded, typically to pick the criteria preset.
     *
     * @param regime optional; drives the band adjustment and the macro sub-score
     * @throws MarketDataUnavailableException if no chain provider is configured
     */
    public MarketScanResult scan(
            List<String> symbols, ScreeningCriteria criteria, RegimeClassification regime, LocalDate asof) {
        return scan(requireChainProvider(), symbols, criteria, regime, asof);
    }

    private ChainDataProvider requireChainProvider() {
        ChainDataProvider chains = chainDataProvider.getIfAvailable();
        if (chains == null) {
            throw new MarketDataUnavailableException("No option chain provider is configured");
        }
        return chains;
    }

    private MarketScanResult scan(
            ChainDataProvider chains,
            List<String> symbols,
            ScreeningCriteria criteria,
            RegimeClassification regime,
            LocalDate asof) {
        InputChecks.requirePresent("symbols", symbols);
        InputChecks.requirePresent("criteria", criteria);
        InputChecks.requirePresent("asof", asof);

        double riskFreeRate = riskFreeRateProvider.getRiskFreeRate(asof);

        List<CompletableFuture<Optional<SymbolChain>>> futures = symbols.stream()
                .distinct()
                .map(symbol -> CompletableFuture.supplyAsync(
                        () -> loadChain(chains, symbol, criteria, riskFreeRate, asof), screenerExecutor))
                .collect(Collectors.toList());

        List<SymbolChain> universe = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<String> requested = symbols.stream().distinct().collect(Collectors.toList());
        for (int i = 0; i < futures.size(); i++) {
            Optional<SymbolChain> chain = futures.get(i).join();
            if (chain.isPresent()) {
                universe.add(chain.get());
            } else {
                skipped.add(requested.get(i));
            }
        }

        ScreeningResult screening = optionsAnalyticsService.screen(universe, criteria, regime, asof);
        log.info("Market scan of {} symbols ({} skipped) returned {} opportunities",
                requested.size(), skipped.size(), screening.getOpportunities().size());

        return MarketScanResult.builder()
                .screening(screening)
                .report(optionsAnalyticsService.report(screening.getOpportunities()))
                .skippedSymbols(List.copyOf(skipped))
                .build();
    }

    /**
     * Regime from the latest reading of the configured volatility index against its history.
     * Empty when no history provider is configured or the history cannot be loaded.
     */
    public Optional<RegimeClassification> currentRegime() {
        IndexHistoryProvider history = indexHistoryProvider.getIfAvailable();
        if (history == null) {
            log.warn("No index history provider is configured; screening without regime");
            return Optional.empty();
        }
        String index = marketDataConfig.getVolatilityIndex();
        try {
            List<Double> levels = history.getHistoricalIndexLevels(index, marketDataConfig.getHistoryWindow());
            if (levels == null || levels.isEmpty()) {
                log.warn("No history returned for {}; screening without regime", index);
                return Optional.empty();
            }
            double current = levels.get(levels.size() - 1);
            return Optional.of(optionsAnalyticsService.classifyRegime(current, levels, null));
        } catch (RuntimeException e) {
            log.warn("Failed to load {} history, screening without regime: {}", index, e.getMessage(), e);
            return Optional.empty();
        }
    }

    /** Loads the expirations inside the DTE band, nearest first, up to the configured cap. */
    private Optional<SymbolChain> loadChain(
            ChainDataProvider chains, String symbol, ScreeningCriteria criteria, double riskFreeRate, LocalDate asof) {
        try {
            List<LocalDate> expirations = chains.getExpirations(symbol).stream()
                    .filter(expiration -> criteria.acceptsDaysToExpiry(ChronoUnit.DAYS.between(asof, expiration)))
                    .sorted()
                    .limit(marketDataConfig.getMaxExpirationsPerSymbol())
                    .collect(Collectors.toList());

            List<OptionContract> contracts = new ArrayList<>();
            for (LocalDate expiration : expirations) {
                contracts.addAll(chains.getChain(symbol, expiration));
            }

            return Optional.of(SymbolChain.builder()
                    .symbol(symbol)
                    .spot(chains.getUnderlyingPrice(symbol))
                    .riskFreeRate(riskFreeRate)
                    .dividendYield(dividendYieldProvider.getDividendYield(symbol, asof))
                    .contracts(contracts)
                    .build());
        } catch (RuntimeException e) {
            log.warn("Skipping {}: failed to load option chain: {}", symbol, e.getMessage(), e);
            return Optional.empty();
        }
    }
}
