package com.marketpulse.marketdata;

import java.time.LocalDate;

/** Continuous annual dividend yield of an underlying as a decimal. */
public interface DividendYieldProvider {

    double getDividendYield(String symbol, LocalDate asof);
}
