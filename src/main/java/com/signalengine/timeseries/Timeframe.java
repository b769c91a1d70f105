package com.signalengine.timeseries;

import java.time.Duration;

/**
 * Supported candle timeframes, ordered from shortest to longest.
 *
 * <p>Each timeframe defines its width in seconds and the short label used in configuration,
 * REST payloads and Redis keys (e.g., "1m", "15m", "1h", "1D"). The width is passed to
 * Redis TimeSeries {@code TS.RANGE AGGREGATION} as the bucket size in milliseconds.
 */
public enum Timeframe {
    ONE_MINUTE(60L, "1m"),
    TWO_MINUTES(120L, "2m"),
    FIVE_MINUTES(300L, "5m"),
    FIFTEEN_MINUTES(900L, "15m"),
    THIRTY_MINUTES(1_800L, "30m"),
    ONE_HOUR(3_600L, "1h"),
    FOUR_HOURS(14_400L, "4h"),
    ONE_DAY(86_400L, "1D");

    private final long seconds;
    private final String label;

    Timeframe(long seconds, String label) {
        this.seconds = seconds;
        this.label = label;
    }

    public long getSeconds() {
        return seconds;
    }

    public long getDurationMs() {
        return seconds * 1000L;
    }

    public Duration getDuration() {
        return Duration.ofSeconds(seconds);
    }

    public String getLabel() {
        return label;
    }

    /**
     * Resolve a Timeframe from its label (e.g., "5m" → FIVE_MINUTES). Labels are matched
     * exactly except for the day timeframe, which also accepts "1d".
     *
     * @throws IllegalArgumentException if no timeframe matches the label
     */
    public static Timeframe fromLabel(String label) {
        for (Timeframe timeframe : values()) {
            if (timeframe.label.equals(label)) {
                return timeframe;
            }
        }
        if ("1d".equals(label)) {
            return ONE_DAY;
        }
        throw new IllegalArgumentException("Unknown timeframe label: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
