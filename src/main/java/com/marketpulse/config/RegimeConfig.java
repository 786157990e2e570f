package com.marketpulse.config;

import com.marketpulse.domain.enums.RegimeBasis;
import com.marketpulse.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Volatility regime thresholds. Properties prefix: {@code marketpulse.regime.*}.
 *
 * <p>Percentile bands: below {@code lowPercentile} is LOW, below {@code normalPercentile}
 * NORMAL, up to and including {@code elevatedPercentile} ELEVATED, above that HIGH.
 * Absolute-level bands work the same way on the raw index (VIX 15 / 20 / 30).
 */
@Data
@Component
@ConfigurationProperties(prefix = "marketpulse.regime")
public class RegimeConfig {

    private RegimeBasis basis = RegimeBasis.PERCENTILE;

    private double lowPercentile = 25.0;
    private double normalPercentile = 60.0;
    private double elevatedPercentile = 85.0;

    private double lowLevel = 15.0;
    private double normalLevel = 20.0;
    private double elevatedLevel = 30.0;

    /** Samples looked back over for the recent-change statistic. */
    private int recentWindow = 5;

    @PostConstruct
    public void validate() {
        if (!(lowPercentile < normalPercentile && normalPercentile < elevatedPercentile)
                || lowPercentile < 0
                || elevatedPercentile > 100) {
            throw new ConfigurationException(
                    "marketpulse.regime percentile thresholds must be ascending within [0, 100]");
        }
        if (!(lowLevel < normalLevel && normalLevel < elevatedLevel) || lowLevel < 0) {
            throw new ConfigurationException("marketpulse.regime level thresholds must be ascending and non-negative");
        }
        if (recentWindow < 2) {
            throw new ConfigurationException("marketpulse.regime.recent-window must be at least 2");
        }
    }
}
