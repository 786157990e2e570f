package com.marketpulse.screener;

import com.marketpulse.domain.enums.ScreenType;
import com.marketpulse.domain.enums.StrategyPreference;
import com.marketpulse.domain.model.RegimeClassification;
import com.marketpulse.domain.model.ScreeningCriteria;

/**
 * Starting criteria per {@link StrategyPreference}.
 *
 * <ul>
 *   <li>PREMIUM_SELLING: |delta| 0.25-0.40, 21-45 DTE, volume and OI &gt;= 200</li>
 *   <li>DIRECTIONAL: |delta| 0.35-0.55, 14-45 DTE, volume and OI &gt;= 100</li>
 *   <li>NEUTRAL: |delta| 0.20-0.45, 21-60 DTE, volume and OI &gt;= 150</li>
 * </ul>
 */
public final class ScreeningPresets {

    private ScreeningPresets() {}

    public static ScreeningCriteria forPreference(StrategyPreference preference, ScreenType screenType) {
        switch (preference) {
            case PREMIUM_SELLING:
                return preset(0.25, 0.40, 21, 45, 200, screenType);
            case DIRECTIONAL:
                return preset(0.35, 0.55, 14, 45, 100, screenType);
            case NEUTRAL:
            default:
                return preset(0.20, 0.45, 21, 60, 150, screenType);
        }
    }

    /** Preset matching the regime's preference, marked regime-aware. */
    public static ScreeningCriteria forRegime(RegimeClassification regime, ScreenType screenType) {
        StrategyPreference preference = regime.getStrategyPreference() != null
                ? regime.getStrategyPreference()
                : regime.getRegime().getStrategyPreference();
        return forPreference(preference, screenType).toBuilder()
                .regimeAware(true)
                .build();
    }

    private static ScreeningCriteria preset(
            double minDelta, double maxDelta, int minDays, int maxDays, long minLiquidity, ScreenType screenType) {
        return ScreeningCriteria.builder()
                .minDelta(minDelta)
                .maxDelta(maxDelta)
                .minDaysToExpiry(minDays)
                .maxDaysToExpiry(maxDays)
                .minVolume(minLiquidity)
                .minOpenInterest(minLiquidity)
                .screenType(screenType)
                .build();
    }
}
