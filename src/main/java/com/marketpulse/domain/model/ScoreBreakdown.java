package com.marketpulse.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * The five weighted sub-scores behind an opportunity's composite score. With the
 * default weights the caps are liquidity 20, probability 25, risk/reward 20,
 * time value 15 and macro context 20.
 */
@Value
@Builder
public class ScoreBreakdown {

    double liquidity;
    double probability;
    double riskReward;
    double timeValue;
    double macroContext;

    public double getTotal() {
        return liquidity + probability + riskReward + timeValue + macroContext;
    }
}
