package com.marketpulse.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Ranked output of one screen plus the bookkeeping needed to explain it: the criteria
 * actually applied after any regime adjustment and how many contracts fell out where.
 */
@Value
@Builder
public class ScreeningResult {

    List<ScoredOpportunity> opportunities;
    ScreeningCriteria appliedCriteria;
    RegimeClassification regime;

    int contractsEvaluated;

    /** Contracts that failed a structural filter (moneyness, DTE, liquidity, delta). */
    int contractsFiltered;

    /** Contracts excluded for missing or unusable quote data. */
    int contractsDropped;

    /** Qualifying opportunities before the top-N cutoff. */
    int totalQualified;
}
