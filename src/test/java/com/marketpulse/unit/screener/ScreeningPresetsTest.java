package com.marketpulse.unit.screener;

import static org.assertj.core.api.Assertions.assertThat;

import com.marketpulse.domain.enums.ScreenType;
import com.marketpulse.domain.enums.StrategyPreference;
import com.marketpulse.domain.enums.VolatilityRegime;
import com.marketpulse.domain.model.RegimeClassification;
import com.marketpulse.domain.model.ScreeningCriteria;
import com.marketpulse.screener.ScreeningPresets;
import org.junit.jupiter.api.Test;

class ScreeningPresetsTest {

    @Test
    void premiumSellingPreset() {
        ScreeningCriteria criteria = ScreeningPresets.forPreference(StrategyPreference.PREMIUM_SELLING, ScreenType.OTM_PUTS);

        assertThat(criteria.getMinDelta()).isEqualTo(0.25);
        assertThat(criteria.getMaxDelta()).isEqualTo(0.40);
        assertThat(criteria.getMinDaysToExpiry()).isEqualTo(21);
        assertThat(criteria.getMaxDaysToExpiry()).isEqualTo(45);
        assertThat(criteria.getMinVolume()).isEqualTo(200);
        assertThat(criteria.getScreenType()).isEqualTo(ScreenType.OTM_PUTS);
        assertThat(criteria.isRegimeAware()).isFalse();
    }

    @Test
    void directionalPreset() {
        ScreeningCriteria criteria = ScreeningPresets.forPreference(StrategyPreference.DIRECTIONAL, ScreenType.OTM_CALLS);

        assertThat(criteria.getMinDelta()).isEqualTo(0.35);
        assertThat(criteria.getMaxDelta()).isEqualTo(0.55);
        assertThat(criteria.getMinDaysToExpiry()).isEqualTo(14);
        assertThat(criteria.getMinOpenInterest()).isEqualTo(100);
    }

    @Test
    void regimePresetFollowsThePreferenceAndIsRegimeAware() {
        RegimeClassification low = RegimeClassification.builder()
                .regime(VolatilityRegime.LOW)
                .strategyPreference(VolatilityRegime.LOW.getStrategyPreference())
                .build();

        ScreeningCriteria criteria = ScreeningPresets.forRegime(low, ScreenType.OTM_CALLS);

        assertThat(criteria.isRegimeAware()).isTrue();
        assertThat(criteria.getMaxDelta()).isEqualTo(0.40);
    }
}
