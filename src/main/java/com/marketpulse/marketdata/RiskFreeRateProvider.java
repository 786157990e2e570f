package com.marketpulse.marketdata;

import java.time.LocalDate;

/** Continuously compounded annual risk-free rate as a decimal. */
public interface RiskFreeRateProvider {

    double getRiskFreeRate(LocalDate asof);
}
