package com.marketpulse.domain.enums;

/**
 * What the regime thresholds are compared against: the percentile rank of the current
 * reading inside its historical window, or the raw index level (e.g. VIX points).
 */
public enum RegimeBasis {
    PERCENTILE,
    ABSOLUTE_LEVEL
}
