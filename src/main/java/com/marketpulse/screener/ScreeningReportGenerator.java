package com.marketpulse.screener;

import com.marketpulse.domain.model.ScoredOpportunity;
import com.marketpulse.domain.model.ScreeningReport;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Summarizes a ranked opportunity list: count, averages and the leading picks.
 * Averages of an empty list are zero.
 */
@Component
public class ScreeningReportGenerator {

    static final int DEFAULT_TOP_PICKS = 5;

    public ScreeningReport generate(List<ScoredOpportunity> opportunities) {
        return generate(opportunities, DEFAULT_TOP_PICKS);
    }

    public ScreeningReport generate(List<ScoredOpportunity> opportunities, int topPicks) {
        if (opportunities.isEmpty()) {
            return ScreeningReport.builder()
                    .totalOpportunities(0)
                    .topPicks(List.of())
                    .averageScore(0)
                    .averageProbability(0)
                    .averageDelta(0)
                    .summary("No opportunities matched the screening criteria")
                    .build();
        }

        double averageScore = opportunities.stream()
                .mapToDouble(ScoredOpportunity::getScore)
                .average()
                .orElse(0);
        double averageProbability = opportunities.stream()
                .mapToDouble(o -> o.getAnalysis().getProbabilityOfProfit())
                .average()
                .orElse(0);
        double averageDelta = opportunities.stream()
                .mapToDouble(o -> Math.abs(o.getAnalysis().getGreeks().getDelta()))
                .average()
                .orElse(0);

        ScoredOpportunity best = opportunities.get(0);
        String summary = String.format(
                "%d opportunities, average score %.1f, average probability of profit %.1f%%. "
                        + "Top pick: %s %s %.2f %s (score %.1f)",
                opportunities.size(),
                averageScore,
                averageProbability,
                best.getSymbol(),
                best.getContract().getExpiration(),
                best.getContract().getStrike(),
                best.getContract().getOptionType(),
                best.getScore());

        return ScreeningReport.builder()
                .totalOpportunities(opportunities.size())
                .topPicks(List.copyOf(opportunities.subList(0, Math.min(topPicks, opportunities.size()))))
                .averageScore(averageScore)
                .averageProbability(averageProbability)
                .averageDelta(averageDelta)
                .summary(summary)
                .build();
    }
}
