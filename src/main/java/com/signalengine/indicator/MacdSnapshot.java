package com.signalengine.indicator;

import java.time.Instant;

/**
 * MACD reading at the last bar of a series.
 *
 * @param macd      MACD line (fast EMA minus slow EMA), the "fast" value of the zone rule
 * @param signal    EMA of the MACD line, the "signal" value of the zone rule
 * @param histogram {@code macd - signal}
 * @param asOf      bucket start of the bar the reading belongs to
 * @param barCount  bars the reading was computed over
 */
public record MacdSnapshot(double macd, double signal, double histogram, Instant asOf, int barCount) {}
