package com.signalengine.timeseries;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * A single closed (or in-progress) OHLCV candle of one instrument over one timeframe bucket.
 *
 * <p>Candles are immutable: the {@link CandleAggregator} replaces its in-progress candle on
 * every tick instead of mutating it, so a candle handed out by {@code current()} or closed
 * by a bucket rollover never changes afterwards. {@code bucketStart} is the inclusive start
 * of the bucket, aligned to a multiple of the timeframe width since the epoch.
 */
@Value
@Builder(toBuilder = true)
public class Candle {

    /** Instrument key ({@code VENUE:TICKER}). */
    String instrumentKey;

    Timeframe timeframe;

    Instant bucketStart;

    BigDecimal open;

    BigDecimal high;

    BigDecimal low;

    BigDecimal close;

    /** Total traded volume in the bucket (sum of tick volumes). */
    long volume;
}
