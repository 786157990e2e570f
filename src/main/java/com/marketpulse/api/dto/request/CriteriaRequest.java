package com.marketpulse.api.dto.request;

import com.marketpulse.domain.enums.ScreenType;
import com.marketpulse.domain.enums.StrategyPreference;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Screening criteria. Unset bands and thresholds come from {@code preset}, or from the
 * NEUTRAL preset when no preset is named. Range checks (inverted or empty bands) are done
 * by the domain object and reported as configuration errors.
 */
@Data
public class CriteriaRequest {

    @NotNull(message = "screenType is required")
    private ScreenType screenType;

    private StrategyPreference preset;

    private Double minDelta;
    private Double maxDelta;
    private Integer minDaysToExpiry;
    private Integer maxDaysToExpiry;
    private Long minVolume;
    private Long minOpenInterest;
    private boolean regimeAware;
    private Integer topN;
    private Double targetDelta;
}
