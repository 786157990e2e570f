package com.marketpulse.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.function.Supplier;
import org.springframework.stereotype.Service;

/**
 * Custom Micrometer meters for the analytics core.
 *
 * <ul>
 *   <li><b>iv.solver.nonconverged</b> (counter): IV solves returned with converged=false</li>
 *   <li><b>screener.contracts.dropped</b> (counter): contracts excluded for bad quote data</li>
 *   <li><b>screener.run</b> (timer): wall time of one screen or market scan</li>
 * </ul>
 *
 * <p>The math classes never touch this; the service facade records around them.
 */
@Service
public class AnalyticsMetricsService {

    private final Counter ivNonConvergedCounter;
    private final Counter contractsDroppedCounter;
    private final Timer screenerRunTimer;

    public AnalyticsMetricsService(MeterRegistry meterRegistry) {
        this.ivNonConvergedCounter = Counter.builder("iv.solver.nonconverged")
                .description("Implied volatility solves that hit the iteration cap or could not bracket the price")
                .register(meterRegistry);

        this.contractsDroppedCounter = Counter.builder("screener.contracts.dropped")
                .description("Contracts dropped from screens for missing or unusable quotes")
                .register(meterRegistry);

        this.screenerRunTimer = Timer.builder("screener.run")
                .description("Duration of one opportunity screen")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(30))
                .register(meterRegistry);
    }

    public void recordIvNonConvergence() {
        ivNonConvergedCounter.increment();
    }

    public void recordDroppedContracts(int count) {
        if (count > 0) {
            contractsDroppedCounter.increment(count);
        }
    }

    public <T> T timeScreen(Supplier<T> screen) {
        return screenerRunTimer.record(screen);
    }
}
