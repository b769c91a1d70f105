package com.signalengine.timeseries;

import java.time.Duration;
import java.time.Instant;

/**
 * Half-open time range {@code [from, to)} of candles to fetch.
 */
public record CandleWindow(Instant from, Instant to) {

    public CandleWindow {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("Window start " + from + " is after end " + to);
        }
    }

    /** The window of the given length ending at {@code end}. */
    public static CandleWindow endingAt(Instant end, Duration length) {
        return new CandleWindow(end.minus(length), end);
    }
}
