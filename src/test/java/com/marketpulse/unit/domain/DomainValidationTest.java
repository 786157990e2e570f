package com.marketpulse.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertNull;

import com.marketpulse.domain.enums.OptionType;
import com.marketpulse.domain.enums.PositionDirection;
import com.marketpulse.domain.enums.ScreenType;
import com.marketpulse.domain.enums.StrategyType;
import com.marketpulse.domain.model.MarketContext;
import com.marketpulse.domain.model.MultiLegStrategy;
import com.marketpulse.domain.model.OptionContract;
import com.marketpulse.domain.model.OptionQuote;
import com.marketpulse.domain.model.PricingInputs;
import com.marketpulse.domain.model.ScreeningCriteria;
import com.marketpulse.domain.model.StrategyLeg;
import com.marketpulse.exception.ConfigurationException;
import com.marketpulse.exception.ErrorCode;
import com.marketpulse.exception.ValidationException;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DomainValidationTest {

    private static final LocalDate ASOF = LocalDate.of(2025, 1, 10);

    private static OptionContract contract(String symbol, double strike, LocalDate expiration) {
        return OptionContract.builder()
                .symbol(symbol)
                .strike(strike)
                .expiration(expiration)
                .optionType(OptionType.CALL)
                .build();
    }

    @Nested
    @DisplayName("Quotes and contracts")
    class QuotesAndContracts {

        @Test
        void midPriceNeedsBothSides() {
            assertThat(OptionQuote.builder().bid(1.0).ask(1.5).build().midPrice()).isEqualTo(1.25);
            assertThat(OptionQuote.builder().ask(1.2).last(1.15).build().midPrice()).isEqualTo(1.15);
            assertNull(OptionQuote.EMPTY.midPrice());
        }

        @Test
        void unusableQuote() {
            assertThat(OptionQuote.EMPTY.isUnusable()).isTrue();
            assertThat(OptionQuote.builder().volume(1).build().isUnusable()).isFalse();
        }

        @Test
        void negativeBidRejected() {
            assertThatThrownBy(() -> OptionQuote.builder().bid(-0.05).build())
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("bid");
        }

        @Test
        void blankSymbolRejected() {
            assertThatThrownBy(() -> contract(" ", 100, ASOF)).isInstanceOf(ValidationException.class);
        }

        @Test
        void nonPositiveStrikeRejected() {
            assertThatThrownBy(() -> contract("SPY", 0, ASOF)).isInstanceOf(ValidationException.class);
        }

        @Test
        void missingQuoteIsEmpty() {
            assertThat(contract("SPY", 100, ASOF).getQuote()).isEqualTo(OptionQuote.EMPTY);
        }
    }

    @Nested
    @DisplayName("Pricing inputs")
    class Inputs {

        @Test
        void negativeVolatilityRejected() {
            assertThatThrownBy(() -> PricingInputs.builder().spot(100).strike(100).timeToExpiry(1).volatility(-0.1).build())
                    .isInstanceOf(ValidationException.class)
                    .extracting("errorCode")
                    .isEqualTo(ErrorCode.VALIDATION_ERROR);
        }

        @Test
        void negativeRateAllowed() {
            PricingInputs inputs =
                    PricingInputs.builder().spot(100).strike(100).timeToExpiry(1).riskFreeRate(-0.005).build();

            assertThat(inputs.getRiskFreeRate()).isEqualTo(-0.005);
        }

        @Test
        void expiryOnAsofIsZeroTime() {
            assertThat(PricingInputs.yearsToExpiry(ASOF, ASOF)).isZero();
            assertThat(PricingInputs.yearsToExpiry(ASOF, ASOF.plusDays(73))).isEqualTo(0.2);
        }

        @Test
        void expiryBeforeAsofRejected() {
            assertThatThrownBy(() -> PricingInputs.yearsToExpiry(ASOF, ASOF.minusDays(1)))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        void marketAcceptsZeroSpot() {
            MarketContext market = MarketContext.builder().spot(0).riskFreeRate(0.05).asof(ASOF).build();

            assertThat(market.getSpot()).isZero();
        }

        @Test
        void marketRejectsNegativeSpot() {
            assertThatThrownBy(() -> MarketContext.builder().spot(-1).asof(ASOF).build())
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("spot");
        }
    }

    @Nested
    @DisplayName("Strategies")
    class Strategies {

        @Test
        void legsMustShareUnderlying() {
            StrategyLeg spy = StrategyLeg.builder()
                    .contract(contract("SPY", 100, ASOF.plusDays(30)))
                    .direction(PositionDirection.LONG)
                    .quantity(1)
                    .build();
            StrategyLeg qqq = StrategyLeg.builder()
                    .contract(contract("QQQ", 110, ASOF.plusDays(30)))
                    .direction(PositionDirection.SHORT)
                    .quantity(1)
                    .build();

            assertThatThrownBy(() -> MultiLegStrategy.builder()
                            .strategyType(StrategyType.BULL_CALL_SPREAD)
                            .legs(List.of(spy, qqq))
                            .build())
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("underlying");
        }

        @Test
        void emptyLegsRejected() {
            assertThatThrownBy(() -> MultiLegStrategy.builder()
                            .strategyType(StrategyType.COVERED_CALL)
                            .legs(List.of())
                            .build())
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        void zeroQuantityRejected() {
            assertThatThrownBy(() -> StrategyLeg.builder()
                            .contract(contract("SPY", 100, ASOF.plusDays(30)))
                            .direction(PositionDirection.LONG)
                            .quantity(0)
                            .build())
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("Screening criteria")
    class Criteria {

        private ScreeningCriteria.ScreeningCriteriaBuilder base() {
            return ScreeningCriteria.builder()
                    .minDelta(0.2)
                    .maxDelta(0.4)
                    .minDaysToExpiry(20)
                    .maxDaysToExpiry(50)
                    .screenType(ScreenType.OTM_PUTS);
        }

        @Test
        void invertedDeltaBandIsAConfigurationError() {
            assertThatThrownBy(() -> base().minDelta(0.5).build())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("inverted");
        }

        @Test
        void deltaAboveOneRejected() {
            assertThatThrownBy(() -> base().maxDelta(1.2).build()).isInstanceOf(ConfigurationException.class);
        }

        @Test
        void invertedDaysRejected() {
            assertThatThrownBy(() -> base().maxDaysToExpiry(10).build()).isInstanceOf(ConfigurationException.class);
        }

        @Test
        void missingScreenTypeRejected() {
            assertThatThrownBy(() -> base().screenType(null).build()).isInstanceOf(ConfigurationException.class);
        }

        @Test
        void putDeltaMatchedOnMagnitude() {
            ScreeningCriteria criteria = base().build();

            assertThat(criteria.acceptsDelta(-0.30)).isTrue();
            assertThat(criteria.acceptsDelta(-0.45)).isFalse();
            assertThat(criteria.acceptsDaysToExpiry(20)).isTrue();
            assertThat(criteria.acceptsDaysToExpiry(51)).isFalse();
        }

        @Test
        void targetDeltaDefaultsToBandMiddle() {
            assertThat(base().build().effectiveTargetDelta()).isCloseTo(0.3, within(1e-12));
            assertThat(base().targetDelta(0.25).build().effectiveTargetDelta()).isEqualTo(0.25);
        }
    }
}
