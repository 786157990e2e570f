package com.marketpulse.domain.enums;

import java.util.List;

/**
 * Discrete volatility-index buckets, declared from calmest to most stressed. The
 * declaration order is the risk order: {@link #ordinal()} never decreases as the
 * index level rises, which is what the classifier's monotonicity relies on.
 *
 * <p>Each regime carries the canned description, risk level, trading implications
 * and screening preference shown to traders.
 */
public enum VolatilityRegime {
    LOW(
            "Low volatility environment - complacent market",
            RiskLevel.LOW,
            StrategyPreference.PREMIUM_SELLING,
            List.of(
                    "Favorable for selling premium (covered calls, cash-secured puts)",
                    "Consider calendar spreads to benefit from time decay",
                    "Be cautious of sudden volatility spikes",
                    "Earnings plays may offer better premium opportunities")),
    NORMAL(
            "Normal volatility - balanced market conditions",
            RiskLevel.MODERATE,
            StrategyPreference.NEUTRAL,
            List.of(
                    "Good environment for directional plays with defined risk",
                    "Bull call spreads and bear put spreads work well",
                    "Consider iron condors if expecting range-bound movement",
                    "Both buying and selling premium viable")),
    ELEVATED(
            "Elevated volatility - increased uncertainty",
            RiskLevel.HIGH,
            StrategyPreference.NEUTRAL,
            List.of(
                    "Premium selling more profitable but riskier",
                    "Use wider spreads for defined-risk strategies",
                    "Be selective with naked positions",
                    "Consider ratio spreads to reduce net cost")),
    HIGH(
            "High volatility - fearful market, major uncertainty",
            RiskLevel.VERY_HIGH,
            StrategyPreference.DIRECTIONAL,
            List.of(
                    "Favor defined-risk strategies (spreads, butterflies)",
                    "Avoid naked short options - risk is elevated",
                    "Look for mean reversion opportunities",
                    "Consider longer-dated options to avoid extreme theta decay",
                    "Volatility may contract - selling premium profitable if timed well"));

    private final String description;
    private final RiskLevel riskLevel;
    private final StrategyPreference strategyPreference;
    private final List<String> tradingImplications;

    VolatilityRegime(
            String description,
            RiskLevel riskLevel,
            StrategyPreference strategyPreference,
            List<String> tradingImplications) {
        this.description = description;
        this.riskLevel = riskLevel;
        this.strategyPreference = strategyPreference;
        this.tradingImplications = tradingImplications;
    }

    public String getDescription() {
        return description;
    }

    public RiskLevel getRiskLevel() {
        return riskLevel;
    }

    public StrategyPreference getStrategyPreference() {
        return strategyPreference;
    }

    public List<String> getTradingImplications() {
        return tradingImplications;
    }

    /** The implications joined into the single free-text line carried by a classification. */
    public String tradingImplicationSummary() {
        return String.join("; ", tradingImplications);
    }
}
