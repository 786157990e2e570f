package com.marketpulse.config;

import com.marketpulse.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Opportunity screener settings. Properties prefix: {@code marketpulse.screener.*}.
 *
 * <p>The five weights are the maximum points of each sub-score and must sum to 100.
 * They are a policy choice, not derived from anything, so they live here rather than
 * in code. Defaults: liquidity 20, probability 25, risk/reward 20, time value 15,
 * macro context 20.
 */
@Data
@Component
@ConfigurationProperties(prefix = "marketpulse.screener")
public class ScreenerConfig {

    private double liquidityWeight = 20.0;
    private double probabilityWeight = 25.0;
    private double riskRewardWeight = 20.0;
    private double timeValueWeight = 15.0;
    private double macroWeight = 20.0;

    /** Opportunities returned when the criteria do not set topN. */
    private int defaultTopN = 20;

    // Fan-out executor for per-symbol screening
    private int corePoolSize = 4;
    private int maxPoolSize = 8;
    private int queueCapacity = 256;

    @PostConstruct
    public void validate() {
        double sum = liquidityWeight + probabilityWeight + riskRewardWeight + timeValueWeight + macroWeight;
        if (liquidityWeight < 0
                || probabilityWeight < 0
                || riskRewardWeight < 0
                || timeValueWeight < 0
                || macroWeight < 0
                || Math.abs(sum - 100.0) > 1e-9) {
            throw new ConfigurationException(
                    "marketpulse.screener weights must be non-negative and sum to 100",
                    Map.of("sum", sum));
        }
        if (defaultTopN <= 0) {
            throw new ConfigurationException("marketpulse.screener.default-top-n must be positive");
        }
        if (corePoolSize <= 0 || maxPoolSize < corePoolSize || queueCapacity < 0) {
            throw new ConfigurationException("marketpulse.screener executor sizing is invalid");
        }
    }
}
