package com.signalengine.scheduler;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.signalengine.config.SignalEngineProperties;
import com.signalengine.domain.enums.PipelineMode;
import com.signalengine.domain.enums.PipelineState;
import com.signalengine.event.JobEvent;
import com.signalengine.event.JobEventType;
import com.signalengine.pipeline.InstrumentRunResult;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Remembers which instruments were backfilled recently.
 *
 * <p>Entries expire {@code realtime-dispatch.backfill-memory} after the last successful
 * backfill, after which the dispatch cycle backfills the instrument again. The memory is
 * bounded by the number of configured instruments.
 */
@Component
public class BackfillTracker {

    private static final Logger log = LoggerFactory.getLogger(BackfillTracker.class);

    private final Cache<String, Instant> backfilled;
    private final Clock clock;

    public BackfillTracker(SignalEngineProperties properties, Clock clock) {
        this.backfilled = Caffeine.newBuilder()
                .expireAfterWrite(properties.getScheduler().getRealtimeDispatch().getBackfillMemory())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
        this.clock = clock;
    }

    @EventListener
    public void onJobEvent(JobEvent jobEvent) {
        if (jobEvent.getEventType() != JobEventType.COMPLETED
                || jobEvent.getJob().getMode() != PipelineMode.BACKFILL
                || jobEvent.getSummary() == null) {
            return;
        }
        for (InstrumentRunResult result : jobEvent.getSummary().getResults()) {
            if (result.getFinalState() == PipelineState.DONE) {
                markBackfilled(result.getInstrumentKey());
            }
        }
    }

    public void markBackfilled(String instrumentKey) {
        backfilled.put(instrumentKey, clock.instant());
        log.debug("Backfill recorded for {}", instrumentKey);
    }

    public boolean isBackfilled(String instrumentKey) {
        return backfilled.getIfPresent(instrumentKey) != null;
    }

    public void forget(String instrumentKey) {
        backfilled.invalidate(instrumentKey);
    }
}
