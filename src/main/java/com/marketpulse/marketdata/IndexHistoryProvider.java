package com.marketpulse.marketdata;

import java.util.List;

/** Daily closes of a volatility index, oldest first, for regime classification. */
public interface IndexHistoryProvider {

    /**
     * @param index  index ticker, e.g. {@code ^VIX}
     * @param window number of most recent observations wanted
     */
    List<Double> getHistoricalIndexLevels(String index, int window);
}
