package com.marketpulse.screener;

import com.marketpulse.config.ScreenerConfig;
import com.marketpulse.domain.enums.ScreenType;
import com.marketpulse.domain.model.OptionQuote;
import com.marketpulse.domain.model.RegimeClassification;
import com.marketpulse.domain.model.ScoreBreakdown;
import com.marketpulse.domain.model.SingleLegAnalysis;
import org.springframework.stereotype.Component;

/**
 * Five weighted sub-scores for a long single-option opportunity. Each sub-score is
 * computed on its native point table and scaled to its configured weight, so the
 * total stays within 0-100 whatever weights are configured.
 *
 * <ol>
 *   <li>Liquidity (table max 20): volume &gt;500/200/100 gives 10/7/5, open interest
 *       &gt;1000/500/100 gives 10/7/5</li>
 *   <li>Probability (table max 25): POP &gt;60/50/40/30 gives 25/20/15/10, else 5</li>
 *   <li>Risk/reward (table max 20): ratio &gt;3/2/1.5/1 gives 20/15/10/5, else 2; without a
 *       finite ratio, premium / distance from spot to breakeven, capped at 1</li>
 *   <li>Time value (table max 15): extrinsic share of the premium times a DTE factor
 *       (30-45 days 15, 21-60 days 12, 14-21 days 8, else 5)</li>
 *   <li>Macro context (table max 20): regime alignment with the screen's bias, +5 when the
 *       index percentile is below 30, -3 above 70; half weight without a regime</li>
 * </ol>
 */
@Component
public class OpportunityScorer {

    private final ScreenerConfig screenerConfig;

    public OpportunityScorer(ScreenerConfig screenerConfig) {
        this.screenerConfig = screenerConfig;
    }

    public ScoreBreakdown score(
            SingleLegAnalysis analysis, double spot, ScreenType screenType, RegimeClassification regime) {
        return ScoreBreakdown.builder()
                .liquidity(scale(liquidityPoints(analysis.getContract().getQuote()), 20.0,
                        screenerConfig.getLiquidityWeight()))
                .probability(scale(probabilityPoints(analysis.getProbabilityOfProfit()), 25.0,
                        screenerConfig.getProbabilityWeight()))
                .riskReward(riskRewardScore(analysis, spot))
                .timeValue(timeValueScore(analysis, spot))
                .macroContext(macroScore(screenType, regime))
                .build();
    }

    static double liquidityPoints(OptionQuote quote) {
        double points = 0;
        long volume = quote.getVolume();
        if (volume > 500) {
            points += 10;
        } else if (volume > 200) {
            points += 7;
        } else if (volume > 100) {
            points += 5;
        }

        long openInterest = quote.getOpenInterest();
        if (openInterest > 1000) {
            points += 10;
        } else if (openInterest > 500) {
            points += 7;
        } else if (openInterest > 100) {
            points += 5;
        }
        return points;
    }

    static double probabilityPoints(double probabilityOfProfit) {
        if (probabilityOfProfit > 60) {
            return 25;
        } else if (probabilityOfProfit > 50) {
            return 20;
        } else if (probabilityOfProfit > 40) {
            return 15;
        } else if (probabilityOfProfit > 30) {
            return 10;
        }
        return 5;
    }

    private double riskRewardScore(SingleLegAnalysis analysis, double spot) {
        double weight = screenerConfig.getRiskRewardWeight();
        Double ratio = analysis.getRiskRewardRatio();
        if (ratio != null) {
            double points;
            if (ratio > 3) {
                points = 20;
            } else if (ratio > 2) {
                points = 15;
            } else if (ratio > 1.5) {
                points = 10;
            } else if (ratio > 1) {
                points = 5;
            } else {
                points = 2;
            }
            return scale(points, 20.0, weight);
        }

        // No finite ratio: premium relative to the move needed to break even
        double distance = Math.abs(analysis.getBreakeven() - spot);
        double proxy = distance > 0 ? Math.min(1.0, analysis.getPremium() / distance) : 1.0;
        return Math.max(scale(2, 20.0, weight), weight * proxy);
    }

    private double timeValueScore(SingleLegAnalysis analysis, double spot) {
        double premium = analysis.getPremium();
        double intrinsic = analysis.getContract().getOptionType().intrinsicValue(spot, analysis.getContract().getStrike());
        double extrinsicShare = premium > 0 ? Math.max(0.0, premium - intrinsic) / premium : 0.0;

        long days = analysis.getDaysToExpiration();
        double dtePoints;
        if (days >= 30 && days <= 45) {
            dtePoints = 15;
        } else if (days >= 21 && days <= 60) {
            dtePoints = 12;
        } else if (days >= 14 && days <= 21) {
            dtePoints = 8;
        } else {
            dtePoints = 5;
        }
        return scale(dtePoints * extrinsicShare, 15.0, screenerConfig.getTimeValueWeight());
    }

    private double macroScore(ScreenType screenType, RegimeClassification regime) {
        double weight = screenerConfig.getMacroWeight();
        if (regime == null) {
            return weight / 2.0;
        }

        double points;
        if (screenType == ScreenType.OTM_CALLS) {
            switch (regime.getRegime()) {
                case LOW:
                    points = 8;
                    break;
                case NORMAL:
                    points = 15;
                    break;
                case ELEVATED:
                    points = 18;
                    break;
                case HIGH:
                default:
                    points = 12;
            }
        } else {
            // Bearish bias pays off more as fear rises
            switch (regime.getRegime()) {
                case LOW:
                    points = 10;
                    break;
                case NORMAL:
                    points = 12;
                    break;
                case ELEVATED:
                    points = 16;
                    break;
                case HIGH:
                default:
                    points = 18;
            }
        }

        // Long options are cheap when the index is low in its range
        if (regime.getPercentile() < 30) {
            points += 5;
        } else if (regime.getPercentile() > 70) {
            points -= 3;
        }
        points = Math.max(0, Math.min(points, 20));
        return scale(points, 20.0, weight);
    }

    private static double scale(double points, double tableMax, double weight) {
        return points / tableMax * weight;
    }
}
