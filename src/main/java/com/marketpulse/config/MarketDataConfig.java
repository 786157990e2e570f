package com.marketpulse.config;

import java.util.HashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Market parameters served by {@link com.marketpulse.marketdata.ConfiguredMarketParameters}
 * and defaults for market scans. Properties prefix: {@code marketpulse.market.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "marketpulse.market")
public class MarketDataConfig {

    /** Continuously compounded annual rate, e.g. 0.045 for 4.5%. */
    private double riskFreeRate = 0.045;

    /** Yield applied to symbols missing from {@link #dividendYields}. */
    private double defaultDividendYield = 0.0;

    /** Continuous dividend yield per symbol, e.g. {@code marketpulse.market.dividend-yields.SPY=0.013}. */
    private Map<String, Double> dividendYields = new HashMap<>();

    /** Volatility index used for regime-aware scans. */
    private String volatilityIndex = "^VIX";

    /** Trading days of index history pulled for percentile ranking. */
    private int historyWindow = 252;

    /** Expirations per symbol screened by a market scan. */
    private int maxExpirationsPerSymbol = 3;
}
