package com.marketpulse.config;

import com.marketpulse.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Implied volatility solver settings. Properties prefix: {@code marketpulse.iv.*}.
 *
 * <p>Defaults:
 * <ul>
 *   <li>initialGuess: 0.30, used when the ATM seed is disabled or not usable</li>
 *   <li>atmSeed: true (Brenner-Subrahmanyam sqrt(2*pi/T) * price / S)</li>
 *   <li>tolerance: 1e-4 in price units</li>
 *   <li>maxIterations: 100 Newton-Raphson steps</li>
 *   <li>lowerBound / upperBound: [1e-4, 5.0], the bisection bracket</li>
 *   <li>maxBisectionIterations: 200</li>
 *   <li>maxNewtonStep: 0.5 vol points per step</li>
 * </ul>
 */
@Data
@Component
@ConfigurationProperties(prefix = "marketpulse.iv")
public class IvSolverConfig {

    private double initialGuess = 0.30;
    private boolean atmSeed = true;
    private double tolerance = 1e-4;
    private int maxIterations = 100;
    private double lowerBound = 1e-4;
    private double upperBound = 5.0;
    private int maxBisectionIterations = 200;
    private double maxNewtonStep = 0.5;

    /** Below this raw vega the Newton step is abandoned in favor of bisection. */
    private double minVega = 1e-10;

    @PostConstruct
    public void validate() {
        if (lowerBound <= 0 || lowerBound >= upperBound) {
            throw new ConfigurationException(
                    "marketpulse.iv bounds must satisfy 0 < lowerBound < upperBound, got ["
                            + lowerBound + ", " + upperBound + "]");
        }
        if (tolerance <= 0 || maxIterations <= 0 || maxBisectionIterations <= 0 || maxNewtonStep <= 0) {
            throw new ConfigurationException("marketpulse.iv tolerance, step and iteration caps must be positive");
        }
    }
}
