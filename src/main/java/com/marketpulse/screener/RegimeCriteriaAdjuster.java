package com.marketpulse.screener;

import com.marketpulse.domain.model.RegimeClassification;
import com.marketpulse.domain.model.ScreeningCriteria;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Tunes screening bands to the volatility regime when the criteria ask for it.
 *
 * <ul>
 *   <li>HIGH: max |delta| - 0.10 and max DTE x 0.75 (further OTM, shorter exposure)</li>
 *   <li>ELEVATED: max |delta| - 0.05 and max DTE x 0.90</li>
 *   <li>NORMAL: unchanged</li>
 *   <li>LOW: delta band widened by 0.05 on both sides</li>
 * </ul>
 * Narrowed bounds never cross the opposite bound, so the result is always a valid band.
 */
@Slf4j
@Component
public class RegimeCriteriaAdjuster {

    static final double HIGH_DELTA_CUT = 0.10;
    static final double HIGH_DTE_FACTOR = 0.75;
    static final double ELEVATED_DELTA_CUT = 0.05;
    static final double ELEVATED_DTE_FACTOR = 0.90;
    static final double LOW_DELTA_WIDEN = 0.05;

    /**
     * @return adjusted criteria, or {@code criteria} itself when it is not regime-aware or
     *     no regime is given
     */
    public ScreeningCriteria adjust(ScreeningCriteria criteria, RegimeClassification regime) {
        if (!criteria.isRegimeAware() || regime == null) {
            return criteria;
        }

        ScreeningCriteria adjusted;
        switch (regime.getRegime()) {
            case HIGH:
                adjusted = narrow(criteria, HIGH_DELTA_CUT, HIGH_DTE_FACTOR);
                break;
            case ELEVATED:
                adjusted = narrow(criteria, ELEVATED_DELTA_CUT, ELEVATED_DTE_FACTOR);
                break;
            case LOW:
                adjusted = criteria.toBuilder()
                        .minDelta(Math.max(0.0, criteria.getMinDelta() - LOW_DELTA_WIDEN))
                        .maxDelta(Math.min(1.0, criteria.getMaxDelta() + LOW_DELTA_WIDEN))
                        .build();
                break;
            case NORMAL:
            default:
                adjusted = criteria;
        }

        if (adjusted != criteria) {
            log.debug("Regime {} adjusted criteria from {} to {}", regime.getRegime(), criteria, adjusted);
        }
        return adjusted;
    }

    private static ScreeningCriteria narrow(ScreeningCriteria criteria, double deltaCut, double dteFactor) {
        double maxDelta = Math.max(criteria.getMinDelta(), criteria.getMaxDelta() - deltaCut);
        int maxDays = Math.max(criteria.getMinDaysToExpiry(), (int) Math.floor(criteria.getMaxDaysToExpiry() * dteFactor));
        return criteria.toBuilder().maxDelta(maxDelta).maxDaysToExpiry(maxDays).build();
    }
}
