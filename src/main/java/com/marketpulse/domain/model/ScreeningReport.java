package com.marketpulse.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Summary statistics over a ranked opportunity list, with the top picks. */
@Value
@Builder
public class ScreeningReport {

    int totalOpportunities;
    List<ScoredOpportunity> topPicks;
    double averageScore;
    double averageProbability;
    double averageDelta;
    String summary;
}
