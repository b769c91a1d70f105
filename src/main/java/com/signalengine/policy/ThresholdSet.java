package com.signalengine.policy;

import com.signalengine.exception.ConfigurationException;

/**
 * Zone thresholds of one instrument on one timeframe.
 *
 * <p>{@code fastThreshold} applies to the MACD line, {@code signalThreshold} to the signal
 * line. Both must be finite and strictly positive; a zero or negative threshold would turn
 * every non-zero reading into a zone.
 */
public record ThresholdSet(double fastThreshold, double signalThreshold) {

    public ThresholdSet {
        requireValid("fastThreshold", fastThreshold);
        requireValid("signalThreshold", signalThreshold);
    }

    /** Same threshold for both lines. */
    public static ThresholdSet uniform(double threshold) {
        return new ThresholdSet(threshold, threshold);
    }

    private static void requireValid(String name, double value) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new ConfigurationException(name + " must be a finite number > 0, got " + value);
        }
    }
}
