package com.marketpulse.domain.model;

import lombok.Builder;
import lombok.Value;

/** A screened contract with its single-leg analysis and composite 0-100 score. */
@Value
@Builder
public class ScoredOpportunity {

    OptionContract contract;
    SingleLegAnalysis analysis;
    double score;
    ScoreBreakdown breakdown;

    public String getSymbol() {
        return contract.getSymbol();
    }
}
