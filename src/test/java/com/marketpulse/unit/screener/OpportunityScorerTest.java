package com.marketpulse.unit.screener;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.marketpulse.config.ScreenerConfig;
import com.marketpulse.domain.enums.OptionType;
import com.marketpulse.domain.enums.PositionDirection;
import com.marketpulse.domain.enums.ScreenType;
import com.marketpulse.domain.enums.VolatilityRegime;
import com.marketpulse.domain.model.Greeks;
import com.marketpulse.domain.model.OptionContract;
import com.marketpulse.domain.model.OptionQuote;
import com.marketpulse.domain.model.PayoffBound;
import com.marketpulse.domain.model.RegimeClassification;
import com.marketpulse.domain.model.ScoreBreakdown;
import com.marketpulse.domain.model.SingleLegAnalysis;
import com.marketpulse.screener.OpportunityScorer;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class OpportunityScorerTest {

    private static final LocalDate EXPIRY = LocalDate.of(2025, 6, 20);

    private ScreenerConfig config;
    private OpportunityScorer scorer;

    @BeforeEach
    void setUp() {
        config = new ScreenerConfig();
        scorer = new OpportunityScorer(config);
    }

    private static SingleLegAnalysis analysis(
            OptionType type, double strike, double premium, long volume, long openInterest, double pop, long days) {
        return analysis(type, strike, premium, volume, openInterest, pop, days, null);
    }

    private static SingleLegAnalysis analysis(
            OptionType type,
            double strike,
            double premium,
            long volume,
            long openInterest,
            double pop,
            long days,
            Double riskReward) {
        OptionContract contract = OptionContract.builder()
                .symbol("IWM")
                .strike(strike)
                .expiration(EXPIRY)
                .optionType(type)
                .quote(OptionQuote.builder()
                        .bid(premium)
                        .ask(premium)
                        .volume(volume)
                        .openInterest(openInterest)
                        .build())
                .build();
        double breakeven = type.isCall() ? strike + premium : strike - premium;
        return SingleLegAnalysis.builder()
                .contract(contract)
                .direction(PositionDirection.LONG)
                .contracts(1)
                .multiplier(100)
                .premium(premium)
                .greeks(Greeks.ZERO)
                .breakevens(List.of(breakeven))
                .maxProfit(PayoffBound.unbounded())
                .maxLoss(PayoffBound.of(premium, premium * 100))
                .riskRewardRatio(riskReward)
                .probabilityOfProfit(pop)
                .daysToExpiration(days)
                .payoffCurve(List.of())
                .build();
    }

    private static RegimeClassification regime(VolatilityRegime regime, double percentile) {
        return RegimeClassification.builder().regime(regime).percentile(percentile).build();
    }

    @Test
    @DisplayName("Liquid 35-day OTM call with a 65% POP and no regime scores 75.7")
    void fullBreakdown() {
        ScoreBreakdown breakdown =
                scorer.score(analysis(OptionType.CALL, 105, 2.0, 600, 2000, 65, 35), 100, ScreenType.OTM_CALLS, null);

        assertThat(breakdown.getLiquidity()).isEqualTo(20.0);
        assertThat(breakdown.getProbability()).isEqualTo(25.0);
        // no finite ratio: premium 2 over the 7 points to breakeven
        assertThat(breakdown.getRiskReward()).isCloseTo(20.0 * 2 / 7, within(1e-9));
        assertThat(breakdown.getTimeValue()).isEqualTo(15.0);
        assertThat(breakdown.getMacroContext()).isEqualTo(10.0);
        assertThat(breakdown.getTotal()).isCloseTo(70.0 + 40.0 / 7, within(1e-9));
    }

    @Nested
    @DisplayName("Sub-score tables")
    class Tables {

        @Test
        @DisplayName("Thin quotes earn partial liquidity points")
        void partialLiquidity() {
            ScoreBreakdown breakdown =
                    scorer.score(analysis(OptionType.CALL, 105, 2.0, 150, 600, 65, 35), 100, ScreenType.OTM_CALLS, null);

            assertThat(breakdown.getLiquidity()).isEqualTo(12.0);
        }

        @Test
        @DisplayName("Probability tiers step down at 60, 50, 40 and 30")
        void probabilityTiers() {
            double[] pops = {61, 55, 45, 35, 10};
            double[] expected = {25, 20, 15, 10, 5};
            for (int i = 0; i < pops.length; i++) {
                ScoreBreakdown breakdown = scorer.score(
                        analysis(OptionType.CALL, 105, 2.0, 600, 2000, pops[i], 35), 100, ScreenType.OTM_CALLS, null);
                assertThat(breakdown.getProbability()).isEqualTo(expected[i]);
            }
        }

        @Test
        @DisplayName("Finite risk/reward uses the ratio tiers")
        void finiteRiskReward() {
            SingleLegAnalysis withRatio = analysis(OptionType.PUT, 95, 2.0, 600, 2000, 30, 35, 2.5);

            assertThat(scorer.score(withRatio, 100, ScreenType.OTM_PUTS, null).getRiskReward()).isEqualTo(15.0);
        }

        @Test
        @DisplayName("Short-dated contracts earn fewer time value points; in-the-money premium earns none")
        void timeValue() {
            assertThat(scorer.score(analysis(OptionType.CALL, 105, 2.0, 600, 2000, 65, 10), 100, ScreenType.OTM_CALLS, null)
                            .getTimeValue())
                    .isEqualTo(5.0);
            // 12 points of intrinsic in a 12.00 premium
            assertThat(scorer.score(analysis(OptionType.CALL, 88, 12.0, 600, 2000, 65, 35), 100, ScreenType.OTM_CALLS, null)
                            .getTimeValue())
                    .isZero();
        }
    }

    @Nested
    @DisplayName("Macro context")
    class Macro {

        @Test
        @DisplayName("Calm market boosts long calls: LOW 8 plus 5 for a low percentile")
        void lowRegimeCalls() {
            ScoreBreakdown breakdown = scorer.score(analysis(OptionType.CALL, 105, 2.0, 600, 2000, 65, 35), 100,
                    ScreenType.OTM_CALLS, regime(VolatilityRegime.LOW, 20));

            assertThat(breakdown.getMacroContext()).isEqualTo(13.0);
        }

        @Test
        @DisplayName("Fearful market favors puts: HIGH 18 minus 3 for a high percentile")
        void highRegimePuts() {
            ScoreBreakdown breakdown = scorer.score(analysis(OptionType.PUT, 95, 2.0, 600, 2000, 30, 35), 100,
                    ScreenType.OTM_PUTS, regime(VolatilityRegime.HIGH, 95));

            assertThat(breakdown.getMacroContext()).isEqualTo(15.0);
        }

        @Test
        @DisplayName("Capped at the table maximum")
        void capped() {
            ScoreBreakdown breakdown = scorer.score(analysis(OptionType.CALL, 105, 2.0, 600, 2000, 65, 35), 100,
                    ScreenType.OTM_CALLS, regime(VolatilityRegime.ELEVATED, 10));

            assertThat(breakdown.getMacroContext()).isEqualTo(20.0);
        }
    }

    @Test
    @DisplayName("Sub-scores rescale to configured weights")
    void customWeights() {
        config.setLiquidityWeight(40);
        config.setProbabilityWeight(20);
        config.setRiskRewardWeight(10);
        config.setTimeValueWeight(10);
        config.setMacroWeight(20);

        ScoreBreakdown breakdown =
                scorer.score(analysis(OptionType.CALL, 105, 2.0, 600, 2000, 65, 35), 100, ScreenType.OTM_CALLS, null);

        assertThat(breakdown.getLiquidity()).isEqualTo(40.0);
        assertThat(breakdown.getProbability()).isEqualTo(20.0);
        assertThat(breakdown.getTimeValue()).isEqualTo(10.0);
        assertThat(breakdown.getTotal()).isLessThanOrEqualTo(100.0);
    }
}
