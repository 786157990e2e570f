package com.marketpulse.regime;

import com.marketpulse.config.RegimeConfig;
import com.marketpulse.domain.enums.RegimeBasis;
import com.marketpulse.domain.enums.VolatilityRegime;
import com.marketpulse.domain.model.IndexStatistics;
import com.marketpulse.domain.model.InputChecks;
import com.marketpulse.domain.model.RegimeClassification;
import com.marketpulse.exception.ValidationException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Component;

/**
 * Maps a volatility index reading and its historical window to a {@link VolatilityRegime}.
 *
 * <p>Percentile rank = (samples &lt;= current) / samples x 100. Bands come from
 * {@link RegimeConfig}, either on the percentile or on the raw level. Both the rank and
 * the band lookup are non-decreasing in the current level, so a higher reading never
 * maps to a calmer regime.
 */
@Slf4j
@Component
public class RegimeClassifier {

    private final RegimeConfig regimeConfig;

    public RegimeClassifier(RegimeConfig regimeConfig) {
        this.regimeConfig = regimeConfig;
    }

    /** Classifies on the configured basis. */
    public RegimeClassification classify(double currentLevel, List<Double> history) {
        return classify(currentLevel, history, regimeConfig.getBasis());
    }

    /**
     * @throws ValidationException if the level is negative or not finite, or the history is
     *     empty or holds a missing, negative or non-finite sample
     */
    public RegimeClassification classify(double currentLevel, List<Double> history, RegimeBasis basis) {
        InputChecks.requireNonNegative("currentLevel", currentLevel);
        InputChecks.requirePresent("basis", basis);
        if (history == null || history.isEmpty()) {
            throw new ValidationException("history", history, "at least one historical sample is required");
        }

        DescriptiveStatistics stats = new DescriptiveStatistics();
        long atOrBelow = 0;
        for (Double sample : history) {
            InputChecks.requirePresent("history sample", sample);
            InputChecks.requireNonNegative("history sample", sample);
            stats.addValue(sample);
            if (sample <= currentLevel) {
                atOrBelow++;
            }
        }
        double percentile = (double) atOrBelow / history.size() * 100.0;

        VolatilityRegime regime = basis == RegimeBasis.PERCENTILE
                ? byPercentile(percentile)
                : byLevel(currentLevel);

        log.debug("Index level {} at percentile {} of {} samples -> {} ({})",
                currentLevel, percentile, history.size(), regime, basis);

        return RegimeClassification.builder()
                .currentLevel(currentLevel)
                .percentile(percentile)
                .regime(regime)
                .basis(basis)
                .riskLevel(regime.getRiskLevel())
                .description(regime.getDescription())
                .tradingImplication(regime.tradingImplicationSummary())
                .tradingImplications(regime.getTradingImplications())
                .strategyPreference(regime.getStrategyPreference())
                .statistics(statistics(currentLevel, history, stats))
                .build();
    }

    VolatilityRegime byPercentile(double percentile) {
        if (percentile < regimeConfig.getLowPercentile()) {
            return VolatilityRegime.LOW;
        }
        if (percentile < regimeConfig.getNormalPercentile()) {
            return VolatilityRegime.NORMAL;
        }
        if (percentile <= regimeConfig.getElevatedPercentile()) {
            return VolatilityRegime.ELEVATED;
        }
        return VolatilityRegime.HIGH;
    }

    VolatilityRegime byLevel(double level) {
        if (level < regimeConfig.getLowLevel()) {
            return VolatilityRegime.LOW;
        }
        if (level < regimeConfig.getNormalLevel()) {
            return VolatilityRegime.NORMAL;
        }
        if (level < regimeConfig.getElevatedLevel()) {
            return VolatilityRegime.ELEVATED;
        }
        return VolatilityRegime.HIGH;
    }

    private IndexStatistics statistics(double currentLevel, List<Double> history, DescriptiveStatistics stats) {
        int lookback = Math.min(regimeConfig.getRecentWindow(), history.size());
        double reference = history.get(history.size() - lookback);
        double change = currentLevel - reference;

        return IndexStatistics.builder()
                .sampleSize(history.size())
                .mean(stats.getMean())
                // Sample standard deviation; a single sample has none
                .standardDeviation(history.size() > 1 ? stats.getStandardDeviation() : 0.0)
                .min(stats.getMin())
                .max(stats.getMax())
                .recentChange(change)
                .recentChangePct(reference != 0 ? change / reference * 100.0 : 0.0)
                .build();
    }
}
