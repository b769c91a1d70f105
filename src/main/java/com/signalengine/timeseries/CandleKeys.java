package com.signalengine.timeseries;

import com.signalengine.config.RedisConfig;

/**
 * Redis TimeSeries keys of the stored base candles, one series per OHLCV field.
 */
final class CandleKeys {

    static final String OPEN = "o";
    static final String HIGH = "h";
    static final String LOW = "l";
    static final String CLOSE = "c";
    static final String VOLUME = "v";

    private CandleKeys() {}

    static String key(String instrumentKey, String field) {
        return RedisConfig.KEY_PREFIX_TIMESERIES + instrumentKey + ":" + field;
    }
}
