package com.tickercontext.features.indicator;

import java.util.ArrayList;
import java.util.List;

/**
 * Pure calculation utilities for the feature vector.
 * Input series are expected oldest-first (last index = most recent bar).
 */
public final class FeatureIndicators {

    /** Closes shorter than this are right-padded with the final price. */
    public static final int PADDED_LENGTH = 21;
    public static final int MA_PERIOD = 20;

    private FeatureIndicators() {}

    // ── Returns ─────────────────────────────────────────────────────────────

    /**
     * @param closes closing prices, oldest-first
     * @param n      number of periods back
     * @return {@code (c[-1] - c[-1-n]) / c[-1-n]}, or 0.0 with fewer than n+1 points or a zero base
     */
    public static double percentReturn(List<Double> closes, int n) {
        if (closes == null || n < 1 || closes.size() < n + 1) return 0.0;
        double last = closes.get(closes.size() - 1);
        double base = closes.get(closes.size() - 1 - n);
        if (base == 0.0) return 0.0;
        return (last - base) / base;
    }

    // ── Moving average ──────────────────────────────────────────────────────

    /**
     * 20-period moving average of the padded series, i.e. the mean of the last 20 values
     * after {@link #padToLength} has extended short input to {@link #PADDED_LENGTH}.
     *
     * @return the average, or NaN for an empty series
     */
    public static double movingAverage20(List<Double> closes) {
        if (closes == null || closes.isEmpty()) return Double.NaN;
        List<Double> series = padToLength(closes, PADDED_LENGTH, closes.get(closes.size() - 1));
        double sum = 0;
        for (int i = series.size() - MA_PERIOD; i < series.size(); i++) sum += series.get(i);
        return sum / MA_PERIOD;
    }

    public static boolean aboveMovingAverage20(List<Double> closes) {
        double ma = movingAverage20(closes);
        if (Double.isNaN(ma)) return false;
        return closes.get(closes.size() - 1) > ma;
    }

    // ── Normalized ATR ──────────────────────────────────────────────────────

    /**
     * Average true range over the last {@code period} bars divided by the last close.
     * True range of bar i = max(high - low, |high - prevClose|, |low - prevClose|).
     * Series of unequal length are aligned on their trailing end. The result is not clamped.
     *
     * @return normalized ATR, or 0.0 with fewer than two aligned bars or a zero last close
     */
    public static double normalizedAtr(List<Double> highs, List<Double> lows, List<Double> closes, int period) {
        if (highs == null || lows == null || closes == null || period < 1) return 0.0;
        int n = Math.min(closes.size(), Math.min(highs.size(), lows.size()));
        if (n < 2) return 0.0;
        List<Double> h = tail(highs, n);
        List<Double> l = tail(lows, n);
        List<Double> c = tail(closes, n);

        int start = Math.max(1, n - period);
        double sum = 0;
        for (int i = start; i < n; i++) {
            double prevClose = c.get(i - 1);
            double tr = Math.max(h.get(i) - l.get(i),
                        Math.max(Math.abs(h.get(i) - prevClose), Math.abs(l.get(i) - prevClose)));
            sum += tr;
        }
        double atr = sum / (n - start);
        double lastClose = c.get(n - 1);
        if (lastClose == 0.0) return 0.0;
        return atr / lastClose;
    }

    // ── Series helpers ──────────────────────────────────────────────────────

    /**
     * Right-pads {@code series} with {@code padValue} until it has {@code length} entries.
     * Longer input is returned unchanged (as a copy).
     */
    public static List<Double> padToLength(List<Double> series, int length, double padValue) {
        List<Double> out = new ArrayList<>(series);
        while (out.size() < length) out.add(padValue);
        return out;
    }

    /** Last {@code count} entries of {@code series}, or all of it when shorter. */
    public static List<Double> tail(List<Double> series, int count) {
        int from = Math.max(0, series.size() - count);
        return new ArrayList<>(series.subList(from, series.size()));
    }

    public static double clamp(double value, double min, double max) {
        return Math.min(Math.max(value, min), max);
    }
}
