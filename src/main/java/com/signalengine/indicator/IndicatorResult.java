package com.signalengine.indicator;

import com.signalengine.domain.enums.Zone;
import com.signalengine.policy.ThresholdSet;
import com.signalengine.timeseries.Timeframe;

/**
 * Classified indicator reading of one timeframe.
 *
 * <p>{@code confidence} is 0 for NEUTRAL; otherwise it is the fraction of the two lines that
 * reach their threshold in the classified direction (0.5 or 1.0).
 */
public record IndicatorResult(
        Timeframe timeframe,
        double fastValue,
        double signalValue,
        ThresholdSet thresholds,
        Zone zone,
        double confidence) {

    public static IndicatorResult classify(
            Timeframe timeframe, double fastValue, double signalValue, ThresholdSet thresholds) {
        Zone zone = ZoneClassifier.classify(fastValue, signalValue, thresholds);
        return new IndicatorResult(
                timeframe, fastValue, signalValue, thresholds, zone, confidence(zone, fastValue, signalValue, thresholds));
    }

    public static IndicatorResult classify(Timeframe timeframe, MacdSnapshot snapshot, ThresholdSet thresholds) {
        return classify(timeframe, snapshot.macd(), snapshot.signal(), thresholds);
    }

    private static double confidence(Zone zone, double fastValue, double signalValue, ThresholdSet thresholds) {
        int crossing = switch (zone) {
            case BULL -> (fastValue >= thresholds.fastThreshold() ? 1 : 0)
                    + (signalValue >= thresholds.signalThreshold() ? 1 : 0);
            case BEAR -> (fastValue <= -thresholds.fastThreshold() ? 1 : 0)
                    + (signalValue <= -thresholds.signalThreshold() ? 1 : 0);
            case NEUTRAL -> 0;
        };
        return crossing / 2.0;
    }
}
