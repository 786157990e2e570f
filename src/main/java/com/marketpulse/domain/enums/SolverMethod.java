package com.marketpulse.domain.enums;

/** Which branch of the implied volatility solver produced the reported estimate. */
public enum SolverMethod {
    NEWTON_RAPHSON,
    BISECTION,
    NONE
}
