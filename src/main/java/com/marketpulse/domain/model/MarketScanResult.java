package com.marketpulse.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Output of a provider-backed market scan: the screen, its report, and symbols that could not be loaded. */
@Value
@Builder
public class MarketScanResult {

    ScreeningResult screening;
    ScreeningReport report;
    List<String> skippedSymbols;
}
