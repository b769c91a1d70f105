package com.signalengine.timeseries;

import com.signalengine.config.SignalEngineProperties;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Persists closed base candles into Redis TimeSeries.
 *
 * <p>Each field goes to its own series ({@code sig:ts:{instrument}:o|h|l|c|v}) at the bucket
 * start timestamp, with DUPLICATE_POLICY LAST so a re-written bucket replaces the old one.
 * Longer timeframes are derived at read time by {@link RedisMarketDataSource}. Series are
 * created lazily on the first write per instrument.
 */
@Component
public class CandleStore {

    private static final Logger log = LoggerFactory.getLogger(CandleStore.class);

    private static final String[] FIELDS = {
        CandleKeys.OPEN, CandleKeys.HIGH, CandleKeys.LOW, CandleKeys.CLOSE, CandleKeys.VOLUME
    };

    private final RedisTimeSeriesClient redisTimeSeriesClient;
    private final SignalEngineProperties properties;

    private final Set<String> initializedInstruments = ConcurrentHashMap.newKeySet();

    public CandleStore(RedisTimeSeriesClient redisTimeSeriesClient, SignalEngineProperties properties) {
        this.redisTimeSeriesClient = redisTimeSeriesClient;
        this.properties = properties;
    }

    public void append(Candle candle) {
        String instrumentKey = candle.getInstrumentKey();
        if (initializedInstruments.add(instrumentKey)) {
            initializeKeys(instrumentKey);
        }

        long epochMs = candle.getBucketStart().toEpochMilli();
        redisTimeSeriesClient.add(CandleKeys.key(instrumentKey, CandleKeys.OPEN), epochMs, candle.getOpen().doubleValue());
        redisTimeSeriesClient.add(CandleKeys.key(instrumentKey, CandleKeys.HIGH), epochMs, candle.getHigh().doubleValue());
        redisTimeSeriesClient.add(CandleKeys.key(instrumentKey, CandleKeys.LOW), epochMs, candle.getLow().doubleValue());
        redisTimeSeriesClient.add(CandleKeys.key(instrumentKey, CandleKeys.CLOSE), epochMs, candle.getClose().doubleValue());
        redisTimeSeriesClient.add(CandleKeys.key(instrumentKey, CandleKeys.VOLUME), epochMs, candle.getVolume());
    }

    private void initializeKeys(String instrumentKey) {
        long retentionMs = properties.getPipeline().getCandleRetention().toMillis();
        for (String field : FIELDS) {
            redisTimeSeriesClient.createIfNotExists(CandleKeys.key(instrumentKey, field), retentionMs, "LAST");
        }
        log.debug("Initialized candle series for {}", instrumentKey);
    }
}
