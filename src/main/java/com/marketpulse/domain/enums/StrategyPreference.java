package com.marketpulse.domain.enums;

/**
 * Screening bias suggested by the volatility regime. Each preference maps to a preset
 * {@link com.marketpulse.domain.model.ScreeningCriteria} in
 * {@link com.marketpulse.screener.ScreeningPresets}.
 */
public enum StrategyPreference {
    PREMIUM_SELLING,
    DIRECTIONAL,
    NEUTRAL
}
