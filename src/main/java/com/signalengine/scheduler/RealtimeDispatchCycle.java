package com.signalengine.scheduler;

import com.signalengine.calendar.MarketCalendarService;
import com.signalengine.config.SignalEngineProperties;
import com.signalengine.domain.enums.Market;
import com.signalengine.domain.enums.PipelineMode;
import com.signalengine.domain.enums.PriorityClass;
import com.signalengine.domain.model.Instrument;
import com.signalengine.exception.BaseException;
import com.signalengine.job.DispatchResult;
import com.signalengine.job.JobDispatcher;
import com.signalengine.job.JobRequest;
import com.signalengine.policy.ConfigRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Periodic job feed for the configured instruments.
 *
 * <p>Each cycle walks the active instruments (restricted to {@code only-symbols} when set):
 * <ul>
 *   <li>not backfilled recently: a BACKFILL job on the backfill queue, dedupe key
 *       {@code bf:<venue>:<ticker>}</li>
 *   <li>backfilled and its market open: a REALTIME job on the market's queue, dedupe key
 *       {@code rt:<venue>:<ticker>:<market queue>}</li>
 * </ul>
 * Jobs still queued or running from a previous cycle hold their dedupe key, so the new
 * request is dropped as a duplicate.
 */
@Component
public class RealtimeDispatchCycle {

    private static final Logger log = LoggerFactory.getLogger(RealtimeDispatchCycle.class);

    private final ConfigRegistry configRegistry;
    private final JobDispatcher jobDispatcher;
    private final BackfillTracker backfillTracker;
    private final MarketCalendarService marketCalendarService;
    private final Clock clock;
    private final SignalEngineProperties.RealtimeDispatch settings;
    private final Set<String> onlySymbols;

    public RealtimeDispatchCycle(
            ConfigRegistry configRegistry,
            JobDispatcher jobDispatcher,
            BackfillTracker backfillTracker,
            MarketCalendarService marketCalendarService,
            SignalEngineProperties properties,
            Clock clock) {
        this.configRegistry = configRegistry;
        this.jobDispatcher = jobDispatcher;
        this.backfillTracker = backfillTracker;
        this.marketCalendarService = marketCalendarService;
        this.clock = clock;
        this.settings = properties.getScheduler().getRealtimeDispatch();
        this.onlySymbols = settings.getOnlySymbols().stream()
                .map(symbol -> symbol.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /** Dispatches one round of jobs. */
    public CycleResult runCycle() {
        Instant now = clock.instant();
        int admitted = 0;
        int duplicates = 0;
        int errors = 0;

        for (Instrument instrument : configRegistry.instruments()) {
            if (!instrument.active() || !(onlySymbols.isEmpty() || onlySymbols.contains(instrument.ticker()))) {
                continue;
            }
            try {
                JobRequest request = nextRequest(instrument, now);
                if (request == null) {
                    continue;
                }
                DispatchResult result = jobDispatcher.dispatch(request);
                if (result.admitted()) {
                    admitted++;
                } else {
                    duplicates++;
                }
            } catch (BaseException e) {
                errors++;
                log.warn("Dispatch failed for {}: {}", instrument.key(), e.getMessage());
            }
        }

        CycleResult result = new CycleResult(admitted, duplicates, errors);
        log.debug("Dispatch cycle: {}", result);
        return result;
    }

    private JobRequest nextRequest(Instrument instrument, Instant now) {
        if (!backfillTracker.isBackfilled(instrument.key())) {
            return JobRequest.builder()
                    .queueName(settings.getBackfillQueue())
                    .instruments(List.of(instrument.key()))
                    .mode(PipelineMode.BACKFILL)
                    .dedupeKey("bf:" + instrument.key())
                    .timeout(settings.getBackfillTimeout())
                    .priorityClass(PriorityClass.BACKFILL)
                    .build();
        }

        Market market = instrument.market();
        if (!marketCalendarService.isMarketOpen(market, now)) {
            return null;
        }
        return JobRequest.builder()
                .queueName(market.getQueueName())
                .instruments(List.of(instrument.key()))
                .mode(PipelineMode.REALTIME)
                .dedupeKey("rt:" + instrument.key() + ":" + market.getQueueName())
                .timeout(settings.getRealtimeTimeout())
                .priorityClass(PriorityClass.REALTIME)
                .build();
    }

    public record CycleResult(int admitted, int duplicates, int errors) {}
}
