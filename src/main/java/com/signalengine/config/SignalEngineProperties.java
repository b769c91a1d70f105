package com.signalengine.config;

import com.signalengine.domain.enums.PolicyComponent;
import com.signalengine.domain.enums.PriorityClass;
import com.signalengine.domain.enums.StrategyType;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed binding of the {@code signalengine.*} configuration tree.
 *
 * <p>These are raw values only. Policies, thresholds and instruments are validated once by
 * {@link com.signalengine.policy.PropertiesConfigRegistry} at start-up; an invalid entry
 * fails the context instead of being defaulted.
 */
@ConfigurationProperties(prefix = "signalengine")
@Getter
@Setter
public class SignalEngineProperties {

    private Macd macd = new Macd();
    private Pipeline pipeline = new Pipeline();

    /** Venue code → venue settings. */
    private Map<String, Venue> venues = new LinkedHashMap<>();

    /** Policy id → policy definition. */
    private Map<String, Policy> policies = new LinkedHashMap<>();

    /** Timeframe label → threshold used when an instrument does not override it. */
    private Map<String, Double> defaultThresholds = new LinkedHashMap<>();

    private List<InstrumentEntry> instruments = new ArrayList<>();

    /** Queue name → number of worker threads consuming it. */
    private Map<String, Integer> queues = new LinkedHashMap<>();

    private Scheduler scheduler = new Scheduler();
    private Lease lease = new Lease();
    private Jobs jobs = new Jobs();
    private Calendar calendar = new Calendar();

    @Getter
    @Setter
    public static class Macd {
        private int fastPeriod = 7;
        private int slowPeriod = 72;
        private int signalPeriod = 144;
    }

    @Getter
    @Setter
    public static class Pipeline {
        /** History pulled per timeframe by a backfill run. */
        private Duration backfillWindow = Duration.ofDays(365);

        /** Bars loaded to warm a cold series before a realtime append. */
        private int warmupBars = 300;

        /** Most recent candles kept per (instrument, timeframe). */
        private int maxBars = 1500;

        /** Width of the candles built from ticks and stored in Redis TimeSeries. */
        private String baseCandleWidth = "1m";

        /** Retention of stored base candles. */
        private Duration candleRetention = Duration.ofDays(400);
    }

    @Getter
    @Setter
    public static class Venue {
        private List<String> timeframes = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Policy {
        private String name;
        private StrategyType type = StrategyType.CUSTOM;
        private String description;
        private List<PolicyComponent> components = new ArrayList<>();

        /** Timeframe label → weight. */
        private Map<String, Double> weights = new LinkedHashMap<>();

        private int consensusMinimum;
        private boolean requireSynchronization;
        private List<String> syncTimeframes = new ArrayList<>();
        private Map<String, String> parameters = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class InstrumentEntry {
        private String ticker;
        private String venue;
        private boolean active = true;
        private String policyId;

        /** Timeframe label → thresholds. */
        private Map<String, Threshold> thresholds = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class Threshold {
        private Double fast;

        /** Falls back to {@code fast} when unset. */
        private Double signal;
    }

    @Getter
    @Setter
    public static class Scheduler {
        private boolean enabled = true;
        private Duration arbiterCadence = Duration.ofSeconds(60);
        private PriorityClass highPriorityClass = PriorityClass.MULTI_TIMEFRAME;

        /** Worker queues paused while the high-priority class holds its lease. */
        private List<String> competingWorkerClasses = new ArrayList<>(List.of("us"));

        private Duration initialBackoff = Duration.ofSeconds(5);
        private Duration maxBackoff = Duration.ofMinutes(5);
        private RealtimeDispatch realtimeDispatch = new RealtimeDispatch();
    }

    @Getter
    @Setter
    public static class RealtimeDispatch {
        private boolean enabled = true;
        private Duration cadence = Duration.ofSeconds(60);

        /** When non-empty, only these tickers are dispatched. */
        private List<String> onlySymbols = new ArrayList<>();

        private String backfillQueue = "backfill";
        private Duration backfillTimeout = Duration.ofMinutes(30);
        private Duration realtimeTimeout = Duration.ofSeconds(300);

        /** How long a successful backfill is remembered before the instrument is backfilled again. */
        private Duration backfillMemory = Duration.ofHours(24);
    }

    @Getter
    @Setter
    public static class Lease {
        /** {@code redis} or {@code memory}. */
        private String store = "redis";
    }

    @Getter
    @Setter
    public static class Jobs {
        private Duration recordRetention = Duration.ofHours(6);
        private Duration pollInterval = Duration.ofSeconds(1);

        /**
         * Longest time a job may wait in its queue. A dedupe claim lives for this plus the job
         * timeout and is re-armed to the job timeout when a worker starts the job.
         */
        private Duration maxQueueWait = Duration.ofHours(2);
    }

    @Getter
    @Setter
    public static class Calendar {
        /** Market (VN, US) → full-day holidays. */
        private Map<String, List<LocalDate>> holidays = new LinkedHashMap<>();
    }
}
