package com.signalengine.domain.enums;

/**
 * BuBeFSM zone of one timeframe: both MACD lines on the same side of zero with at least
 * one of them beyond the threshold, or NEUTRAL.
 */
public enum Zone {
    BULL,
    BEAR,
    NEUTRAL
}
