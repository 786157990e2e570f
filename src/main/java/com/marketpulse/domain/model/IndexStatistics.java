package com.marketpulse.domain.model;

import lombok.Builder;
import lombok.Value;

/** Summary of the historical window a regime classification was made against. */
@Value
@Builder
public class IndexStatistics {

    int sampleSize;
    double mean;
    double standardDeviation;
    double min;
    double max;

    /** Current level minus the level at the start of the recent window. */
    double recentChange;

    /** {@link #recentChange} as a percentage of the window-start level; 0 when that level is 0. */
    double recentChangePct;
}
