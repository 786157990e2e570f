package com.marketpulse.domain.model;

import com.marketpulse.domain.enums.SolverMethod;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of an implied volatility solve.
 *
 * <p>When {@code converged} is false, {@code volatility} is the best estimate the solver
 * reached (smallest pricing error seen) and {@code message} says why it stopped. The
 * caller decides whether to trust it.
 */
@Value
@Builder
public class ImpliedVolResult {

    double volatility;
    boolean converged;
    int iterations;
    SolverMethod method;

    /** |model price - target| at the reported volatility, in price units. */
    double priceError;

    String message;
}
