package com.signalengine.timeseries;

import com.signalengine.domain.model.Instrument;
import com.signalengine.exception.DataUnavailableException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * {@link MarketDataSource} over the base candles kept by {@link CandleStore}.
 *
 * <p>Candles of any timeframe are computed on demand with five {@code TS.RANGE} queries using
 * first/max/min/last/sum aggregation at the timeframe's bucket width, joined on bucket timestamp.
 * No per-timeframe series are maintained.
 *
 * <p>Calls go through the {@code marketData} retry and circuit breaker. When the breaker is
 * open the call fails fast with {@link DataUnavailableException}.
 */
@Service
public class RedisMarketDataSource implements MarketDataSource {

    private static final Logger log = LoggerFactory.getLogger(RedisMarketDataSource.class);

    private final RedisTimeSeriesClient redisTimeSeriesClient;
    private final Clock clock;

    public RedisMarketDataSource(RedisTimeSeriesClient redisTimeSeriesClient, Clock clock) {
        this.redisTimeSeriesClient = redisTimeSeriesClient;
        this.clock = clock;
    }

    @Override
    @CircuitBreaker(name = "marketData", fallbackMethod = "fetchCandlesFallback")
    @Retry(name = "marketData")
    public List<Candle> fetchCandles(Instrument instrument, Timeframe timeframe, CandleWindow window) {
        // TS.RANGE bounds are inclusive
        long from = window.from().toEpochMilli();
        long to = window.to().toEpochMilli() - 1;
        List<Candle> candles = queryCandles(instrument.key(), timeframe, from, to);
        log.debug("Fetched {} {} candles for {}", candles.size(), timeframe, instrument.key());
        return candles;
    }

    @Override
    @CircuitBreaker(name = "marketData", fallbackMethod = "latestCandleFallback")
    @Retry(name = "marketData")
    public Optional<Candle> latestCandle(Instrument instrument, Timeframe timeframe) {
        Instant now = clock.instant();
        long to = now.toEpochMilli();
        long from = to - 2 * timeframe.getDurationMs();
        List<Candle> candles = queryCandles(instrument.key(), timeframe, from, to);
        return candles.isEmpty() ? Optional.empty() : Optional.of(candles.get(candles.size() - 1));
    }

    List<Candle> queryCandles(String instrumentKey, Timeframe timeframe, long fromEpochMs, long toEpochMs) {
        long bucketMs = timeframe.getDurationMs();

        List<RedisTimeSeriesClient.TsSample> opens = redisTimeSeriesClient.range(
                CandleKeys.key(instrumentKey, CandleKeys.OPEN), fromEpochMs, toEpochMs, "first", bucketMs);
        List<RedisTimeSeriesClient.TsSample> highs = redisTimeSeriesClient.range(
                CandleKeys.key(instrumentKey, CandleKeys.HIGH), fromEpochMs, toEpochMs, "max", bucketMs);
        List<RedisTimeSeriesClient.TsSample> lows = redisTimeSeriesClient.range(
                CandleKeys.key(instrumentKey, CandleKeys.LOW), fromEpochMs, toEpochMs, "min", bucketMs);
        List<RedisTimeSeriesClient.TsSample> closes = redisTimeSeriesClient.range(
                CandleKeys.key(instrumentKey, CandleKeys.CLOSE), fromEpochMs, toEpochMs, "last", bucketMs);
        List<RedisTimeSeriesClient.TsSample> volumes = redisTimeSeriesClient.range(
                CandleKeys.key(instrumentKey, CandleKeys.VOLUME), fromEpochMs, toEpochMs, "sum", bucketMs);

        return mergeCandles(instrumentKey, timeframe, opens, highs, lows, closes, volumes);
    }

    /**
     * Joins the five aggregation replies on bucket timestamp. A bucket missing from any of the
     * four price series (partial write) is dropped; a missing volume bucket counts as zero.
     */
    private List<Candle> mergeCandles(
            String instrumentKey,
            Timeframe timeframe,
            List<RedisTimeSeriesClient.TsSample> opens,
            List<RedisTimeSeriesClient.TsSample> highs,
            List<RedisTimeSeriesClient.TsSample> lows,
            List<RedisTimeSeriesClient.TsSample> closes,
            List<RedisTimeSeriesClient.TsSample> volumes) {

        if (opens.isEmpty() || highs.isEmpty() || lows.isEmpty() || closes.isEmpty()) {
            return Collections.emptyList();
        }

        Map<Long, Double> highByBucket = byBucket(highs);
        Map<Long, Double> lowByBucket = byBucket(lows);
        Map<Long, Double> closeByBucket = byBucket(closes);
        Map<Long, Double> volumeByBucket = byBucket(volumes);

        List<Candle> candles = new ArrayList<>(opens.size());
        int dropped = 0;
        for (RedisTimeSeriesClient.TsSample open : opens) {
            Double high = highByBucket.get(open.timestamp());
            Double low = lowByBucket.get(open.timestamp());
            Double close = closeByBucket.get(open.timestamp());
            if (high == null || low == null || close == null) {
                dropped++;
                continue;
            }
            candles.add(Candle.builder()
                    .instrumentKey(instrumentKey)
                    .timeframe(timeframe)
                    .bucketStart(Instant.ofEpochMilli(open.timestamp()))
                    .open(BigDecimal.valueOf(open.value()))
                    .high(BigDecimal.valueOf(high))
                    .low(BigDecimal.valueOf(low))
                    .close(BigDecimal.valueOf(close))
                    .volume(volumeByBucket.getOrDefault(open.timestamp(), 0d).longValue())
                    .build());
        }
        if (dropped > 0) {
            log.debug("Dropped {} incomplete {} buckets for {}", dropped, timeframe, instrumentKey);
        }
        return candles;
    }

    private static Map<Long, Double> byBucket(List<RedisTimeSeriesClient.TsSample> samples) {
        Map<Long, Double> values = new HashMap<>(samples.size() * 2);
        for (RedisTimeSeriesClient.TsSample sample : samples) {
            values.put(sample.timestamp(), sample.value());
        }
        return values;
    }

    private List<Candle> fetchCandlesFallback(
            Instrument instrument, Timeframe timeframe, CandleWindow window, Throwable throwable) {
        throw asDataUnavailable(instrument, timeframe, throwable);
    }

    private Optional<Candle> latestCandleFallback(Instrument instrument, Timeframe timeframe, Throwable throwable) {
        throw asDataUnavailable(instrument, timeframe, throwable);
    }

    private DataUnavailableException asDataUnavailable(Instrument instrument, Timeframe timeframe, Throwable throwable) {
        if (throwable instanceof DataUnavailableException dataUnavailable) {
            return dataUnavailable;
        }
        return new DataUnavailableException(
                "Market data unavailable for " + instrument.key() + " " + timeframe, throwable);
    }
}
