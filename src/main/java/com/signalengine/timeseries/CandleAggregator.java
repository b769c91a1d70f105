package com.signalengine.timeseries;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Optional;

/**
 * Folds a stream of quote ticks into fixed-width OHLCV candles.
 *
 * <p>Bucket id = {@code floor(epochSecond / width) * width}. A tick in a newer bucket closes
 * the in-progress candle (returned from {@link #addTick}) and opens a new one seeded with the
 * tick's mid price and volume. A tick in the current bucket updates high/low/close and adds
 * its volume. A tick in an older bucket is late and is dropped without touching any candle.
 *
 * <p>Not thread-safe. Each instance belongs to exactly one ingestion loop.
 */
public class CandleAggregator {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final int PRICE_SCALE = 8;

    private final String instrumentKey;
    private final Timeframe timeframe;
    private final long widthSeconds;

    private Candle current;
    private long droppedTicks;

    public CandleAggregator(String instrumentKey, Timeframe timeframe) {
        this.instrumentKey = instrumentKey;
        this.timeframe = timeframe;
        this.widthSeconds = timeframe.getSeconds();
    }

    /**
     * Incorporates one tick.
     *
     * @return the candle closed by this tick, if it rolled the bucket over
     */
    public Optional<Candle> addTick(Instant timestamp, BigDecimal bid, BigDecimal ask, long volume) {
        Instant bucket = bucketOf(timestamp);
        BigDecimal mid = bid.add(ask).divide(TWO, PRICE_SCALE, RoundingMode.HALF_UP).stripTrailingZeros();

        if (current == null) {
            current = open(bucket, mid, volume);
            return Optional.empty();
        }

        int cmp = bucket.compareTo(current.getBucketStart());
        if (cmp < 0) {
            droppedTicks++;
            return Optional.empty();
        }
        if (cmp > 0) {
            Candle closed = current;
            current = open(bucket, mid, volume);
            return Optional.of(closed);
        }

        current = current.toBuilder()
                .high(current.getHigh().max(mid))
                .low(current.getLow().min(mid))
                .close(mid)
                .volume(current.getVolume() + volume)
                .build();
        return Optional.empty();
    }

    /** The in-progress candle, or empty before the first tick. */
    public Optional<Candle> current() {
        return Optional.ofNullable(current);
    }

    /** Number of late ticks dropped so far. */
    public long getDroppedTicks() {
        return droppedTicks;
    }

    public Timeframe getTimeframe() {
        return timeframe;
    }

    Instant bucketOf(Instant timestamp) {
        long epochSecond = timestamp.getEpochSecond();
        return Instant.ofEpochSecond(Math.floorDiv(epochSecond, widthSeconds) * widthSeconds);
    }

    private Candle open(Instant bucket, BigDecimal price, long volume) {
        return Candle.builder()
                .instrumentKey(instrumentKey)
                .timeframe(timeframe)
                .bucketStart(bucket)
                .open(price)
                .high(price)
                .low(price)
                .close(price)
                .volume(volume)
                .build();
    }
}
