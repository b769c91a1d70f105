package com.signalengine.indicator;

import com.signalengine.timeseries.Candle;
import com.signalengine.timeseries.Timeframe;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cached candle history of one instrument on one timeframe.
 *
 * <p>Holds at most {@code maxBars} candles ordered by bucket start; the oldest are evicted
 * first. A {@link ReadWriteLock} guards the deque because backfill and realtime runs of
 * different jobs may touch the same series while reads happen on HTTP threads.
 */
public class CandleSeries {

    private static final Logger log = LoggerFactory.getLogger(CandleSeries.class);

    @Getter
    private final String instrumentKey;

    @Getter
    private final Timeframe timeframe;

    private final int maxBars;
    private final Deque<Candle> candles = new ArrayDeque<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public CandleSeries(String instrumentKey, Timeframe timeframe, int maxBars) {
        this.instrumentKey = instrumentKey;
        this.timeframe = timeframe;
        this.maxBars = maxBars;
    }

    /** Replaces the whole history, keeping only the most recent {@code maxBars}. */
    public void replaceAll(List<Candle> history) {
        lock.writeLock().lock();
        try {
            candles.clear();
            for (Candle candle : history) {
                appendLocked(candle);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Appends the candle. A candle for the last bucket replaces it (the bucket was still in
     * progress when first seen); a candle older than the last bucket is ignored.
     *
     * @return false if the candle was ignored
     */
    public boolean append(Candle candle) {
        lock.writeLock().lock();
        try {
            return appendLocked(candle);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<Candle> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(new ArrayList<>(candles));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return candles.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    private boolean appendLocked(Candle candle) {
        Candle last = candles.peekLast();
        if (last != null) {
            int cmp = candle.getBucketStart().compareTo(last.getBucketStart());
            if (cmp < 0) {
                log.debug("Ignoring stale {} candle for {} at {}", timeframe, instrumentKey, candle.getBucketStart());
                return false;
            }
            if (cmp == 0) {
                candles.pollLast();
            }
        }
        candles.addLast(candle);
        while (candles.size() > maxBars) {
            candles.pollFirst();
        }
        return true;
    }
}
