package com.marketpulse.domain.model;

import com.marketpulse.domain.enums.RegimeBasis;
import com.marketpulse.domain.enums.RiskLevel;
import com.marketpulse.domain.enums.StrategyPreference;
import com.marketpulse.domain.enums.VolatilityRegime;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Volatility regime derived from one index reading and its historical window.
 * Recomputed from scratch on every call; nothing here is cached.
 */
@Value
@Builder
public class RegimeClassification {

    double currentLevel;

    /** Share of historical samples at or below the current level, 0-100. */
    double percentile;

    VolatilityRegime regime;
    RegimeBasis basis;
    RiskLevel riskLevel;
    String description;

    /** One-line summary of {@link #tradingImplications}. */
    String tradingImplication;

    List<String> tradingImplications;
    StrategyPreference strategyPreference;
    IndexStatistics statistics;
}
