package com.tickercontext.features.service;

import com.tickercontext.common.model.FeatureVector;
import com.tickercontext.features.indicator.FeatureIndicators;

import java.util.List;

/**
 * Deterministic feature set served in non-live mode and after a total provider failure.
 * Derived from a fixed 21-bar OHLC series so the values exercise the same indicator code
 * as live data.
 */
public final class SyntheticFeatures {

    static final List<Double> CLOSES = List.of(
        100.0, 101.0, 102.0, 103.0, 103.0, 104.0, 105.0, 104.0, 103.0, 102.0, 103.0,
        104.0, 103.0, 102.0, 101.0, 100.0, 99.0, 99.0, 100.0, 101.0, 102.0);
    static final List<Double> HIGHS = List.of(
        101.0, 102.0, 103.0, 104.0, 104.0, 105.0, 106.0, 105.0, 104.0, 103.0, 104.0,
        105.0, 104.0, 103.0, 102.0, 101.0, 100.0, 100.0, 101.0, 102.0, 103.0);
    static final List<Double> LOWS = List.of(
        99.0, 100.0, 101.0, 102.0, 102.0, 103.0, 104.0, 103.0, 102.0, 101.0, 102.0,
        103.0, 102.0, 101.0, 100.0, 99.0, 98.0, 98.0, 99.0, 100.0, 101.0);

    static final int MINS_SINCE_NEWS = 12;

    private SyntheticFeatures() {}

    public static FeatureVector build() {
        double rv20 = FeatureIndicators.normalizedAtr(HIGHS, LOWS, CLOSES, FeatureIndicators.MA_PERIOD);
        return new FeatureVector(
            0.0, 0.05,
            FeatureIndicators.percentReturn(CLOSES, 1),
            FeatureIndicators.percentReturn(CLOSES, 5),
            FeatureIndicators.aboveMovingAverage20(CLOSES),
            MINS_SINCE_NEWS,
            FeatureIndicators.clamp(rv20, FeatureAggregator.RV20_MIN, FeatureAggregator.RV20_MAX),
            false,
            true);
    }
}
