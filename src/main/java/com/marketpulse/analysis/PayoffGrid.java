package com.marketpulse.analysis;

import com.marketpulse.config.AnalysisConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Spot prices at which an expiration payoff curve is sampled.
 *
 * <p>The grid spans spot +/- {@code span} x spot x sigma x sqrt(T), falls back to
 * +/- {@code fallbackRangePct} x spot when there is no volatility or time left, never
 * goes below zero, and is stretched to cover every anchor (strikes, breakevens). The
 * anchors themselves are inserted so kinks in the payoff land exactly on a sample.
 */
public final class PayoffGrid {

    private PayoffGrid() {}

    /**
     * @param spot            current underlying price
     * @param totalVolatility sigma x sqrt(T) of the underlying
     * @param config          grid size and span
     * @param anchors         prices that must appear in the grid; negative values are ignored
     * @return ascending, duplicate-free sample prices
     */
    public static List<Double> spots(double spot, double totalVolatility, AnalysisConfig config, double... anchors) {
        double halfWidth = config.getPayoffStdDevSpan() * spot * totalVolatility;
        if (!(halfWidth > 0)) {
            halfWidth = spot * config.getFallbackRangePct();
        }

        double low = Math.max(0.0, spot - halfWidth);
        double high = spot + halfWidth;
        for (double anchor : anchors) {
            if (anchor >= 0 && Double.isFinite(anchor)) {
                low = Math.min(low, anchor);
                high = Math.max(high, anchor);
            }
        }

        TreeSet<Double> grid = new TreeSet<>();
        int points = config.getPayoffGridPoints();
        double step = (high - low) / (points - 1);
        for (int i = 0; i < points; i++) {
            grid.add(i == points - 1 ? high : low + i * step);
        }
        for (double anchor : anchors) {
            if (anchor >= 0 && Double.isFinite(anchor)) {
                grid.add(anchor);
            }
        }
        return new ArrayList<>(grid);
    }
}
