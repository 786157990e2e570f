package com.marketpulse.core.processor;

import static com.marketpulse.domain.model.PricingInputs.DAYS_PER_YEAR;

import com.marketpulse.domain.enums.OptionType;
import com.marketpulse.domain.model.Greeks;
import com.marketpulse.domain.model.OptionPrice;
import com.marketpulse.domain.model.PricingInputs;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Component;

/**
 * Black-Scholes-Merton price and Greeks for European options with a continuous
 * dividend yield.
 *
 * <p>Key formulas:
 * <ul>
 *   <li>d1 = [ln(S/K) + (r - q + sigma^2/2) * T] / (sigma * sqrt(T))
 *   <li>d2 = d1 - sigma * sqrt(T)
 *   <li>Delta: N(d1) * e^(-qT) for calls, [N(d1) - 1] * e^(-qT) for puts
 *   <li>Gamma: n(d1) * e^(-qT) / (S * sigma * sqrt(T))
 *   <li>Theta: -dPrice/dT / 365, per calendar day
 *   <li>Vega: S * e^(-qT) * n(d1) * sqrt(T) / 100, per 1 vol point
 *   <li>Rho: K * T * e^(-rT) * N(d2) / 100 for calls, -K * T * e^(-rT) * N(-d2) / 100 for puts
 * </ul>
 *
 * <p>Degenerate inputs never divide by zero:
 * <ul>
 *   <li>T = 0: price is intrinsic value, delta is +1/-1 when strictly in the money and 0
 *       otherwise, every other Greek is 0
 *   <li>sigma = 0 (or S = 0) with T &gt; 0: the payoff is deterministic, priced off the
 *       discounted forward. Gamma and vega are 0; delta, theta and rho are the exact
 *       derivatives of the deterministic price
 * </ul>
 *
 * <p>Stateless and thread-safe. Identical inputs give bit-identical outputs; time only
 * enters through {@link PricingInputs#getTimeToExpiry()}.
 */
@Component
public class BlackScholesPricer {

    // Reusable standard normal distribution (thread-safe in commons-math3)
    private static final NormalDistribution NORM = new NormalDistribution();

    public double price(PricingInputs inputs, OptionType type) {
        double S = inputs.getSpot();
        double K = inputs.getStrike();
        double T = inputs.getTimeToExpiry();

        if (inputs.isExpired()) {
            return type.intrinsicValue(S, K);
        }
        if (isDeterministic(inputs)) {
            return Math.max(0.0, forwardIntrinsic(inputs, type));
        }

        double r = inputs.getRiskFreeRate();
        double q = inputs.getDividendYield();
        double d1 = d1(inputs);
        double d2 = d1 - inputs.totalVolatility();

        if (type.isCall()) {
            return S * Math.exp(-q * T) * NORM.cumulativeProbability(d1)
                    - K * Math.exp(-r * T) * NORM.cumulativeProbability(d2);
        }
        return K * Math.exp(-r * T) * NORM.cumulativeProbability(-d2)
                - S * Math.exp(-q * T) * NORM.cumulativeProbability(-d1);
    }

    public Greeks greeks(PricingInputs inputs, OptionType type) {
        if (inputs.isExpired()) {
            return expiredGreeks(inputs, type);
        }
        if (isDeterministic(inputs)) {
            return deterministicGreeks(inputs, type);
        }

        double S = inputs.getSpot();
        double K = inputs.getStrike();
        double T = inputs.getTimeToExpiry();
        double r = inputs.getRiskFreeRate();
        double q = inputs.getDividendYield();
        double sigma = inputs.getVolatility();
        double sqrtT = Math.sqrt(T);

        double d1 = d1(inputs);
        double d2 = d1 - sigma * sqrtT;
        double nd1 = NORM.density(d1);
        double expQT = Math.exp(-q * T);
        double expRT = Math.exp(-r * T);

        double gamma = expQT * nd1 / (S * sigma * sqrtT);
        double vega = S * expQT * nd1 * sqrtT / 100.0;

        // Time decay common to both sides
        double decay = -(S * expQT * nd1 * sigma) / (2.0 * sqrtT);

        double delta;
        double thetaAnnual;
        double rho;
        if (type.isCall()) {
            delta = expQT * NORM.cumulativeProbability(d1);
            thetaAnnual = decay
                    - r * K * expRT * NORM.cumulativeProbability(d2)
                    + q * S * expQT * NORM.cumulativeProbability(d1);
            rho = K * T * expRT * NORM.cumulativeProbability(d2) / 100.0;
        } else {
            delta = expQT * (NORM.cumulativeProbability(d1) - 1.0);
            thetaAnnual = decay
                    + r * K * expRT * NORM.cumulativeProbability(-d2)
                    - q * S * expQT * NORM.cumulativeProbability(-d1);
            rho = -K * T * expRT * NORM.cumulativeProbability(-d2) / 100.0;
        }

        return Greeks.builder()
                .delta(delta)
                .gamma(gamma)
                .theta(thetaAnnual / DAYS_PER_YEAR)
                .vega(vega)
                .rho(rho)
                .build();
    }

    /** Price, Greeks, and the intrinsic/extrinsic split in one call. */
    public OptionPrice priceWithGreeks(PricingInputs inputs, OptionType type) {
        double price = price(inputs, type);
        double intrinsic = type.intrinsicValue(inputs.getSpot(), inputs.getStrike());
        return OptionPrice.builder()
                .optionType(type)
                .price(price)
                .intrinsicValue(intrinsic)
                .extrinsicValue(Math.max(0.0, price - intrinsic))
                .greeks(greeks(inputs, type))
                .inputs(inputs)
                .build();
    }

    /**
     * dPrice/dSigma without the per-point scaling, the derivative the IV solver steps with.
     * Zero whenever the price does not depend on volatility.
     */
    public double rawVega(PricingInputs inputs) {
        if (inputs.isExpired() || isDeterministic(inputs)) {
            return 0.0;
        }
        double T = inputs.getTimeToExpiry();
        return inputs.getSpot()
                * Math.exp(-inputs.getDividendYield() * T)
                * NORM.density(d1(inputs))
                * Math.sqrt(T);
    }

    /**
     * Risk-neutral probability that the underlying finishes strictly above {@code level}
     * at expiry: N(d2) with d2 = [ln(S/level) + (r - q - sigma^2/2) * T] / (sigma * sqrt(T)).
     * With no uncertainty left the answer is 0 or 1, read off the forward price.
     */
    public double probabilityAbove(PricingInputs inputs, double level) {
        if (level <= 0) {
            return 1.0;
        }
        double S = inputs.getSpot();
        double T = inputs.getTimeToExpiry();
        if (S == 0) {
            return 0.0;
        }
        if (inputs.isExpired() || inputs.getVolatility() == 0) {
            double forward = S * Math.exp((inputs.getRiskFreeRate() - inputs.getDividendYield()) * T);
            return forward > level ? 1.0 : 0.0;
        }
        double sigma = inputs.getVolatility();
        double d2 = (Math.log(S / level)
                        + (inputs.getRiskFreeRate() - inputs.getDividendYield() - sigma * sigma / 2.0) * T)
                / (sigma * Math.sqrt(T));
        return NORM.cumulativeProbability(d2);
    }

    public double probabilityBelow(PricingInputs inputs, double level) {
        return 1.0 - probabilityAbove(inputs, level);
    }

    private static double d1(PricingInputs inputs) {
        double sigma = inputs.getVolatility();
        double T = inputs.getTimeToExpiry();
        return (Math.log(inputs.getSpot() / inputs.getStrike())
                        + (inputs.getRiskFreeRate() - inputs.getDividendYield() + sigma * sigma / 2.0) * T)
                / (sigma * Math.sqrt(T));
    }

    private static boolean isDeterministic(PricingInputs inputs) {
        return inputs.getVolatility() == 0 || inputs.getSpot() == 0;
    }

    /** S*e^(-qT) - K*e^(-rT) for calls, the negation for puts. */
    private static double forwardIntrinsic(PricingInputs inputs, OptionType type) {
        double T = inputs.getTimeToExpiry();
        double discountedSpot = inputs.getSpot() * Math.exp(-inputs.getDividendYield() * T);
        double discountedStrike = inputs.getStrike() * Math.exp(-inputs.getRiskFreeRate() * T);
        double callValue = discountedSpot - discountedStrike;
        return type.isCall() ? callValue : -callValue;
    }

    private static Greeks expiredGreeks(PricingInputs inputs, OptionType type) {
        boolean inTheMoney = type.intrinsicValue(inputs.getSpot(), inputs.getStrike()) > 0;
        double delta = inTheMoney ? (type.isCall() ? 1.0 : -1.0) : 0.0;
        return Greeks.builder().delta(delta).gamma(0).theta(0).vega(0).rho(0).build();
    }

    private static Greeks deterministicGreeks(PricingInputs inputs, OptionType type) {
        if (forwardIntrinsic(inputs, type) <= 0) {
            return Greeks.ZERO;
        }
        double T = inputs.getTimeToExpiry();
        double r = inputs.getRiskFreeRate();
        double q = inputs.getDividendYield();
        double discountedSpot = inputs.getSpot() * Math.exp(-q * T);
        double discountedStrike = inputs.getStrike() * Math.exp(-r * T);
        double sign = type.isCall() ? 1.0 : -1.0;

        // Price = sign * (S*e^(-qT) - K*e^(-rT)); theta is -dPrice/dT per day
        double dPriceDt = sign * (-q * discountedSpot + r * discountedStrike);
        return Greeks.builder()
                .delta(sign * Math.exp(-q * T))
                .gamma(0)
                .theta(-dPriceDt / DAYS_PER_YEAR)
                .vega(0)
                .rho(sign * inputs.getStrike() * T * Math.exp(-r * T) / 100.0)
                .build();
    }
}
