package com.marketpulse.unit.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.marketpulse.analysis.SingleLegAnalyzer;
import com.marketpulse.config.AnalysisConfig;
import com.marketpulse.config.IvSolverConfig;
import com.marketpulse.core.processor.BlackScholesPricer;
import com.marketpulse.core.processor.IVCalculator;
import com.marketpulse.domain.enums.OptionType;
import com.marketpulse.domain.enums.PositionDirection;
import com.marketpulse.domain.model.MarketContext;
import com.marketpulse.domain.model.OptionContract;
import com.marketpulse.domain.model.OptionQuote;
import com.marketpulse.domain.model.PayoffPoint;
import com.marketpulse.domain.model.PricingInputs;
import com.marketpulse.domain.model.SingleLegAnalysis;
import com.marketpulse.exception.DataQualityException;
import com.marketpulse.exception.ValidationException;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for SingleLegAnalyzer: breakeven, payoff bounds, probability of profit,
 * volatility precedence and the expiration payoff curve.
 */
class SingleLegAnalyzerTest {

    private static final LocalDate ASOF = LocalDate.of(2025, 1, 2);
    private static final LocalDate EXPIRY = ASOF.plusDays(91);

    private final BlackScholesPricer pricer = new BlackScholesPricer();
    private SingleLegAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new SingleLegAnalyzer(pricer, new IVCalculator(pricer, new IvSolverConfig()), new AnalysisConfig());
    }

    private static OptionContract contract(OptionType type, double strike, OptionQuote quote) {
        return OptionContract.builder()
                .symbol("SPY")
                .strike(strike)
                .expiration(EXPIRY)
                .optionType(type)
                .quote(quote)
                .build();
    }

    private static OptionQuote quote(double bid, double ask, Double iv) {
        return OptionQuote.builder()
                .bid(bid)
                .ask(ask)
                .volume(500)
                .openInterest(2000)
                .impliedVolatility(iv)
                .build();
    }

    private static MarketContext market(Double vol) {
        return MarketContext.builder()
                .spot(100)
                .riskFreeRate(0.05)
                .dividendYield(0.0)
                .volatility(vol)
                .asof(ASOF)
                .build();
    }

    @Nested
    @DisplayName("Long call")
    class LongCall {

        private SingleLegAnalysis analysis;

        @BeforeEach
        void analyze() {
            analysis = analyzer.analyze(
                    contract(OptionType.CALL, 100, quote(4.5, 4.7, 0.2)), PositionDirection.LONG, 1, null, market(null));
        }

        @Test
        @DisplayName("Breakeven is strike plus the quote mid")
        void breakeven() {
            assertThat(analysis.getPremium()).isCloseTo(4.6, within(1e-12));
            assertThat(analysis.getBreakeven()).isCloseTo(104.6, within(1e-12));
            assertThat(analysis.getBreakevens()).hasSize(1);
        }

        @Test
        @DisplayName("Max profit is unbounded and max loss is the premium paid")
        void bounds() {
            assertTrue(analysis.getMaxProfit().isUnbounded());
            assertThat(analysis.getMaxLoss().getPerShare()).isCloseTo(4.6, within(1e-12));
            assertThat(analysis.getMaxLoss().getTotal()).isCloseTo(460.0, within(1e-9));
            assertThat(analysis.getRiskRewardRatio()).isNull();
        }

        @Test
        @DisplayName("Cost basis is a debit and position theta is negative")
        void costAndTheta() {
            assertThat(analysis.getCostBasis()).isCloseTo(-460.0, within(1e-9));
            assertThat(analysis.getPositionThetaPerDay())
                    .isCloseTo(analysis.getGreeks().getTheta() * 100, within(1e-12))
                    .isNegative();
        }

        @Test
        @DisplayName("Probability of profit is N(d2) at the breakeven, below delta")
        void probabilityOfProfit() {
            PricingInputs inputs = PricingInputs.builder()
                    .spot(100)
                    .strike(100)
                    .timeToExpiry(91 / 365.0)
                    .riskFreeRate(0.05)
                    .volatility(0.2)
                    .build();
            double expected = pricer.probabilityAbove(inputs, 104.6) * 100;

            assertThat(analysis.getProbabilityOfProfit()).isCloseTo(expected, within(1e-9));
            assertThat(analysis.getProbabilityOfProfit()).isLessThan(analysis.getGreeks().getDelta() * 100);
        }

        @Test
        @DisplayName("Payoff curve is ascending, contains strike and breakeven, and matches the expiry P&L")
        void payoffCurve() {
            List<PayoffPoint> curve = analysis.getPayoffCurve();

            for (int i = 1; i < curve.size(); i++) {
                assertThat(curve.get(i).getSpot()).isGreaterThan(curve.get(i - 1).getSpot());
            }
            assertThat(curve).extracting(PayoffPoint::getSpot).contains(100.0, analysis.getBreakeven());
            PayoffPoint atBreakeven = curve.stream()
                    .filter(p -> p.getSpot() == analysis.getBreakeven())
                    .findFirst()
                    .orElseThrow();
            assertThat(atBreakeven.getPnl()).isCloseTo(0.0, within(1e-9));
            assertThat(curve.get(0).getPnl()).isCloseTo(-460.0, within(1e-9));
            assertThat(analyzer.pnlAtExpiration(analysis, 120)).isCloseTo(1540.0, within(1e-9));
        }

        @Test
        @DisplayName("Payoff grid spans three standard deviations around spot")
        void gridSpan() {
            double halfWidth = 3 * 100 * 0.2 * Math.sqrt(91 / 365.0);
            List<PayoffPoint> curve = analysis.getPayoffCurve();

            assertThat(curve.get(0).getSpot()).isCloseTo(100 - halfWidth, within(1e-9));
            assertThat(curve.get(curve.size() - 1).getSpot()).isCloseTo(100 + halfWidth, within(1e-9));
        }

        @Test
        @DisplayName("Days to expiration come from the as-of date")
        void daysToExpiration() {
            assertThat(analysis.getDaysToExpiration()).isEqualTo(91);
        }
    }

    @Nested
    @DisplayName("Other positions")
    class OtherPositions {

        @Test
        @DisplayName("Short call has unbounded loss and collects the premium")
        void shortCall() {
            SingleLegAnalysis analysis = analyzer.analyze(
                    contract(OptionType.CALL, 100, quote(4.5, 4.7, 0.2)), PositionDirection.SHORT, 2, null, market(null));

            assertTrue(analysis.getMaxLoss().isUnbounded());
            assertThat(analysis.getMaxProfit().getTotal()).isCloseTo(920.0, within(1e-9));
            assertThat(analysis.getCostBasis()).isCloseTo(920.0, within(1e-9));
            assertThat(analysis.getPositionThetaPerDay()).isPositive();
        }

        @Test
        @DisplayName("Long and short probabilities of the same contract sum to 100")
        void complementaryProbability() {
            OptionContract c = contract(OptionType.PUT, 95, quote(1.9, 2.1, 0.25));
            double longPop = analyzer.analyze(c, PositionDirection.LONG, 1, null, market(null)).getProbabilityOfProfit();
            double shortPop = analyzer.analyze(c, PositionDirection.SHORT, 1, null, market(null)).getProbabilityOfProfit();

            assertThat(longPop + shortPop).isCloseTo(100.0, within(1e-9));
        }

        @Test
        @DisplayName("Long put max profit is strike minus premium, floored at zero spot")
        void longPut() {
            SingleLegAnalysis analysis = analyzer.analyze(
                    contract(OptionType.PUT, 95, quote(1.9, 2.1, 0.25)), PositionDirection.LONG, 1, null, market(null));

            assertThat(analysis.getBreakeven()).isCloseTo(93.0, within(1e-12));
            assertThat(analysis.getMaxProfit().getTotal()).isCloseTo(9300.0, within(1e-9));
            assertThat(analysis.getMaxLoss().getTotal()).isCloseTo(200.0, within(1e-9));
            assertThat(analysis.getRiskRewardRatio()).isCloseTo(46.5, within(1e-9));
        }

        @Test
        @DisplayName("A zero spot prices the put at its discounted strike and is certain to finish below breakeven")
        void longPutAtZeroSpot() {
            MarketContext zeroSpot = market(0.25).toBuilder().spot(0).build();

            SingleLegAnalysis analysis = analyzer.analyze(
                    contract(OptionType.PUT, 95, quote(1.9, 2.1, null)), PositionDirection.LONG, 1, null, zeroSpot);

            assertThat(analysis.getTheoreticalPrice()).isCloseTo(95 * Math.exp(-0.05 * 91 / 365.0), within(1e-9));
            assertThat(analysis.getProbabilityOfProfit()).isCloseTo(100.0, within(1e-12));
            assertThat(analysis.getPayoffCurve().get(0).getSpot()).isZero();
            assertThat(analysis.getPayoffCurve().get(0).getPnl()).isCloseTo(9300.0, within(1e-9));
        }

        @Test
        @DisplayName("Short put max loss is strike minus premium")
        void shortPut() {
            SingleLegAnalysis analysis = analyzer.analyze(
                    contract(OptionType.PUT, 95, quote(1.9, 2.1, 0.25)), PositionDirection.SHORT, 1, null, market(null));

            assertThat(analysis.getMaxLoss().getPerShare()).isCloseTo(93.0, within(1e-12));
            assertThat(analysis.getMaxProfit().getPerShare()).isCloseTo(2.0, within(1e-12));
        }
    }

    @Nested
    @DisplayName("Premium and volatility sources")
    class Sources {

        @Test
        @DisplayName("Explicit premium overrides the quote mid")
        void premiumOverride() {
            SingleLegAnalysis analysis = analyzer.analyze(
                    contract(OptionType.CALL, 100, quote(4.5, 4.7, 0.2)), PositionDirection.LONG, 1, 5.0, market(null));

            assertThat(analysis.getPremium()).isEqualTo(5.0);
            assertThat(analysis.getMidPrice()).isCloseTo(4.6, within(1e-12));
            assertThat(analysis.getBreakeven()).isEqualTo(105.0);
        }

        @Test
        @DisplayName("Market volatility overrides the quote IV")
        void volatilityOverride() {
            SingleLegAnalysis analysis = analyzer.analyze(
                    contract(OptionType.CALL, 100, quote(4.5, 4.7, 0.2)), PositionDirection.LONG, 1, null, market(0.35));

            assertThat(analysis.getVolatility()).isEqualTo(0.35);
        }

        @Test
        @DisplayName("Quote IV is used when no override is given")
        void quoteVolatility() {
            SingleLegAnalysis analysis = analyzer.analyze(
                    contract(OptionType.CALL, 100, quote(4.5, 4.7, 0.22)), PositionDirection.LONG, 1, null, market(null));

            assertThat(analysis.getVolatility()).isEqualTo(0.22);
            assertTrue(analysis.isVolatilityConverged());
        }

        @Test
        @DisplayName("IV is solved from the premium when neither is available")
        void solvedVolatility() {
            SingleLegAnalysis analysis = analyzer.analyze(
                    contract(OptionType.CALL, 100, quote(4.5, 4.7, null)), PositionDirection.LONG, 1, null, market(null));

            assertTrue(analysis.isVolatilityConverged());
            assertThat(analysis.getTheoreticalPrice()).isCloseTo(4.6, within(1e-3));
        }

        @Test
        @DisplayName("Last trade is used when the book is one-sided")
        void lastTrade() {
            OptionQuote lastOnly = OptionQuote.builder().bid(0).ask(4.8).last(4.4).impliedVolatility(0.2).build();

            SingleLegAnalysis analysis = analyzer.analyze(
                    contract(OptionType.CALL, 100, lastOnly), PositionDirection.LONG, 1, null, market(null));

            assertThat(analysis.getPremium()).isEqualTo(4.4);
        }
    }

    @Nested
    @DisplayName("Rejected input")
    class Rejected {

        @Test
        @DisplayName("Missing premium and an unpriced quote is a data quality error")
        void noPremium() {
            OptionContract unpriced = contract(OptionType.CALL, 100, OptionQuote.EMPTY);

            assertThatThrownBy(() -> analyzer.analyze(unpriced, PositionDirection.LONG, 1, null, market(0.2)))
                    .isInstanceOf(DataQualityException.class)
                    .hasMessageContaining("SPY");
        }

        @Test
        @DisplayName("Zero contracts is rejected")
        void zeroContracts() {
            assertThatThrownBy(() -> analyzer.analyze(
                            contract(OptionType.CALL, 100, quote(4.5, 4.7, 0.2)),
                            PositionDirection.LONG,
                            0,
                            null,
                            market(null)))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Contract that expired before the as-of date is rejected")
        void expiredBeforeAsof() {
            MarketContext later = market(null).toBuilder().asof(EXPIRY.plusDays(1)).build();

            assertThatThrownBy(() -> analyzer.analyze(
                            contract(OptionType.CALL, 100, quote(4.5, 4.7, 0.2)), PositionDirection.LONG, 1, null, later))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("expiration");
        }
    }
}
