package com.marketpulse.config;

import com.marketpulse.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Position analysis settings. Properties prefix: {@code marketpulse.analysis.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "marketpulse.analysis")
public class AnalysisConfig {

    /** Shares per listed contract. */
    private int contractMultiplier = 100;

    /** Evenly spaced samples in a payoff curve, before strike and breakeven are inserted. */
    private int payoffGridPoints = 61;

    /** Half-width of the payoff grid in standard deviations (sigma * sqrt(T)) of spot. */
    private double payoffStdDevSpan = 3.0;

    /** Half-width as a fraction of spot when sigma * sqrt(T) is zero. */
    private double fallbackRangePct = 0.30;

    @PostConstruct
    public void validate() {
        if (contractMultiplier <= 0) {
            throw new ConfigurationException("marketpulse.analysis.contract-multiplier must be positive");
        }
        if (payoffGridPoints < 2) {
            throw new ConfigurationException("marketpulse.analysis.payoff-grid-points must be at least 2");
        }
        if (payoffStdDevSpan <= 0 || fallbackRangePct <= 0 || fallbackRangePct >= 1) {
            throw new ConfigurationException(
                    "marketpulse.analysis payoff span must be positive and fallback range within (0, 1)");
        }
    }
}
