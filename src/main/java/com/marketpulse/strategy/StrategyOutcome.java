package com.marketpulse.strategy;

import com.marketpulse.domain.model.CoveredCallMetrics;
import com.marketpulse.domain.model.PayoffBound;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Shape-specific figures a template derives; the composer merges them into the analysis. */
@Value
@Builder
public class StrategyOutcome {

    List<Double> breakevens;
    PayoffBound maxProfit;
    PayoffBound maxLoss;
    double probabilityOfProfit;
    Double spreadWidth;
    CoveredCallMetrics coveredCall;
}
