package com.marketpulse.core.processor;

import com.marketpulse.config.IvSolverConfig;
import com.marketpulse.domain.enums.OptionType;
import com.marketpulse.domain.enums.SolverMethod;
import com.marketpulse.domain.model.ImpliedVolResult;
import com.marketpulse.domain.model.InputChecks;
import com.marketpulse.domain.model.PricingInputs;
import com.marketpulse.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Newton-Raphson implied volatility solver with bisection fallback for European options.
 *
 * <p>Newton-Raphson uses raw vega (dPrice/dSigma) as the derivative and usually converges
 * in 3-5 iterations near the money. Each step is clamped to {@code maxNewtonStep} and the
 * iterate is kept inside the bisection bracket. When vega underflows (deep ITM/OTM, tiny T)
 * or the iteration cap is hit, the solver bisects over [{@code lowerBound}, {@code upperBound}].
 *
 * <p>The seed is the Brenner-Subrahmanyam ATM approximation sqrt(2*pi/T) * price / S when
 * enabled and finite, otherwise {@code initialGuess}.
 *
 * <p>Failure never throws: a target the model cannot reach inside the bracket, an expired
 * contract, or an exhausted iteration budget returns the best estimate seen with
 * {@code converged = false}. Only a malformed price (negative or not finite) is rejected.
 *
 * <p>This class is stateless and thread-safe.
 */
@Slf4j
@Component
public class IVCalculator {

    private final BlackScholesPricer pricer;
    private final IvSolverConfig config;

    public IVCalculator(BlackScholesPricer pricer, IvSolverConfig config) {
        this.pricer = pricer;
        this.config = config;
    }

    /**
     * Solves for the volatility at which the model reproduces {@code marketPrice}.
     *
     * @param marketPrice observed option price per share
     * @param inputs      spot, strike, time, rate and yield; the volatility field is ignored
     * @param type        call or put
     * @throws ValidationException if the market price is negative or not finite
     */
    public ImpliedVolResult solve(double marketPrice, PricingInputs inputs, OptionType type) {
        InputChecks.requireNonNegative("marketPrice", marketPrice);

        if (inputs.isExpired()) {
            return unsolvable("time to expiry is zero, volatility has no effect on price");
        }
        if (marketPrice == 0) {
            return unsolvable("market price is zero");
        }
        if (inputs.getSpot() == 0) {
            return unsolvable("spot is zero, volatility has no effect on price");
        }

        double lower = config.getLowerBound();
        double upper = config.getUpperBound();
        double tolerance = config.getTolerance();

        double lowerPrice = pricer.price(inputs.withVolatility(lower), type);
        if (marketPrice < lowerPrice - tolerance) {
            return outOfBracket(marketPrice, inputs, type, lower, lowerPrice, "below the minimum model price");
        }
        double upperPrice = pricer.price(inputs.withVolatility(upper), type);
        if (marketPrice > upperPrice + tolerance) {
            return outOfBracket(marketPrice, inputs, type, upper, upperPrice, "above the maximum model price");
        }

        BestEstimate best = new BestEstimate();
        double sigma = seed(marketPrice, inputs);
        int iterations = 0;

        for (int i = 0; i < config.getMaxIterations(); i++) {
            iterations++;
            PricingInputs trial = inputs.withVolatility(sigma);
            double diff = pricer.price(trial, type) - marketPrice;
            best.offer(sigma, diff);

            if (Math.abs(diff) < tolerance) {
                return converged(sigma, iterations, SolverMethod.NEWTON_RAPHSON, diff);
            }

            double vega = pricer.rawVega(trial);
            if (vega < config.getMinVega()) {
                log.debug(
                        "Vega {} underflowed at sigma={} for K={}, T={}, price={}, falling back to bisection",
                        vega,
                        sigma,
                        inputs.getStrike(),
                        inputs.getTimeToExpiry(),
                        marketPrice);
                break;
            }

            double step = clamp(diff / vega, -config.getMaxNewtonStep(), config.getMaxNewtonStep());
            sigma = clamp(sigma - step, lower, upper);
        }

        log.debug(
                "Newton-Raphson did not converge for K={}, T={}, price={}, type={} after {} iterations, bisecting",
                inputs.getStrike(),
                inputs.getTimeToExpiry(),
                marketPrice,
                type,
                iterations);

        double lo = lower;
        double hi = upper;
        for (int i = 0; i < config.getMaxBisectionIterations(); i++) {
            iterations++;
            double mid = (lo + hi) / 2.0;
            double diff = pricer.price(inputs.withVolatility(mid), type) - marketPrice;
            best.offer(mid, diff);

            if (Math.abs(diff) < tolerance) {
                return converged(mid, iterations, SolverMethod.BISECTION, diff);
            }
            // Price is increasing in sigma for calls and puts alike
            if (diff > 0) {
                hi = mid;
            } else {
                lo = mid;
            }
        }

        log.warn(
                "IV solver did not converge for K={}, T={}, price={}, type={}: best sigma={} with error {}",
                inputs.getStrike(),
                inputs.getTimeToExpiry(),
                marketPrice,
                type,
                best.sigma,
                best.error);
        return ImpliedVolResult.builder()
                .volatility(best.sigma)
                .converged(false)
                .iterations(iterations)
                .method(SolverMethod.BISECTION)
                .priceError(best.error)
                .message("iteration cap reached")
                .build();
    }

    /** Brenner-Subrahmanyam seed, clamped into the bracket; the configured guess if unusable. */
    double seed(double marketPrice, PricingInputs inputs) {
        if (config.isAtmSeed()) {
            double guess = Math.sqrt(2.0 * Math.PI / inputs.getTimeToExpiry()) * marketPrice / inputs.getSpot();
            if (Double.isFinite(guess) && guess > 0) {
                return clamp(guess, config.getLowerBound(), config.getUpperBound());
            }
        }
        return clamp(config.getInitialGuess(), config.getLowerBound(), config.getUpperBound());
    }

    private ImpliedVolResult outOfBracket(
            double marketPrice, PricingInputs inputs, OptionType type, double bound, double boundPrice, String why) {
        log.warn(
                "Market price {} for K={}, T={}, type={} is {} ({} at sigma={})",
                marketPrice,
                inputs.getStrike(),
                inputs.getTimeToExpiry(),
                type,
                why,
                boundPrice,
                bound);
        return ImpliedVolResult.builder()
                .volatility(bound)
                .converged(false)
                .iterations(0)
                .method(SolverMethod.NONE)
                .priceError(Math.abs(boundPrice - marketPrice))
                .message("market price is " + why)
                .build();
    }

    private static ImpliedVolResult unsolvable(String reason) {
        log.warn("Implied volatility not solvable: {}", reason);
        return ImpliedVolResult.builder()
                .volatility(0.0)
                .converged(false)
                .iterations(0)
                .method(SolverMethod.NONE)
                .priceError(Double.NaN)
                .message(reason)
                .build();
    }

    private static ImpliedVolResult converged(double sigma, int iterations, SolverMethod method, double diff) {
        return ImpliedVolResult.builder()
                .volatility(sigma)
                .converged(true)
                .iterations(iterations)
                .method(method)
                .priceError(Math.abs(diff))
                .message(null)
                .build();
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(value, max));
    }

    private static final class BestEstimate {
        private double sigma = Double.NaN;
        private double error = Double.POSITIVE_INFINITY;

        void offer(double candidate, double diff) {
            if (Math.abs(diff) < error) {
                sigma = candidate;
                error = Math.abs(diff);
            }
        }
    }
}
