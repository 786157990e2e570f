package com.marketpulse.marketdata;

import com.marketpulse.config.MarketDataConfig;
import java.time.LocalDate;
import org.springframework.stereotype.Component;

/**
 * Rate and dividend providers backed by {@code marketpulse.market.*} properties.
 * Values are read on every call; nothing is cached here.
 */
@Component
public class ConfiguredMarketParameters implements RiskFreeRateProvider, DividendYieldProvider {

    private final MarketDataConfig marketDataConfig;

    public ConfiguredMarketParameters(MarketDataConfig marketDataConfig) {
        this.marketDataConfig = marketDataConfig;
    }

    @Override
    public double getRiskFreeRate(LocalDate asof) {
        return marketDataConfig.getRiskFreeRate();
    }

    @Override
    public double getDividendYield(String symbol, LocalDate asof) {
        return marketDataConfig.getDividendYields().getOrDefault(symbol, marketDataConfig.getDefaultDividendYield());
    }
}
