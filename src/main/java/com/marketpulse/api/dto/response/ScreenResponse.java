package com.marketpulse.api.dto.response;

import com.marketpulse.domain.model.ScreeningReport;
import com.marketpulse.domain.model.ScreeningResult;
import lombok.Builder;
import lombok.Getter;

/** Result of {@code POST /api/options/screen}: the ranked screen and its summary report. */
@Getter
@Builder
public class ScreenResponse {

    private final ScreeningResult screening;
    private final ScreeningReport report;
}
