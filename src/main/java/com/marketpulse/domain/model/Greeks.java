package com.marketpulse.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Option sensitivities under the desk conventions: theta per calendar day, vega per
 * one volatility point (0.01), rho per one rate point (0.01).
 *
 * <p>Always derived from a {@link PricingInputs}; never stored on its own.
 */
@Value
@Builder
public class Greeks {

    public static final Greeks ZERO =
            Greeks.builder().delta(0).gamma(0).theta(0).vega(0).rho(0).build();

    double delta;
    double gamma;
    double theta;
    double vega;
    double rho;

    /** Multiplies every sensitivity by {@code factor} (quantity times direction sign). */
    public Greeks scaled(double factor) {
        return Greeks.builder()
                .delta(delta * factor)
                .gamma(gamma * factor)
                .theta(theta * factor)
                .vega(vega * factor)
                .rho(rho * factor)
                .build();
    }

    public Greeks plus(Greeks other) {
        return Greeks.builder()
                .delta(delta + other.delta)
                .gamma(gamma + other.gamma)
                .theta(theta + other.theta)
                .vega(vega + other.vega)
                .rho(rho + other.rho)
                .build();
    }
}
