package com.signalengine.config;

import java.time.Duration;
import org.springframework.context.annotation.Configuration;

/**
 * Redis key schema.
 *
 * <p>All keys are prefixed with "sig:" because the Redis server is shared with the broker
 * bridge. Repositories and stores build their keys from these constants only.
 *
 * <p>Key schema:
 * <pre>
 *   sig:ts:{venue}:{ticker}:{o|h|l|c|v}  → Redis TimeSeries of stored base candles
 *   sig:signal:{venue}:{ticker}          → latest AggregatedSignal JSON (TTL 24h)
 *   sig:signals:all                      → Set of instrument keys with a stored signal
 *   sig:job:dedup:{dedupeKey}            → job id holding the dedupe claim (TTL = job timeout)
 *   sig:lease:{workflowClass}            → "{ownerId}|{acquiredAtMs}" (PX = lease ttl)
 * </pre>
 *
 * <p>Spring Boot's auto-configured {@code StringRedisTemplate} is used everywhere; values
 * are either plain strings or JSON written with the application {@code ObjectMapper}.
 */
@Configuration
public class RedisConfig {

    public static final String KEY_PREFIX = "sig:";

    public static final String KEY_PREFIX_TIMESERIES = KEY_PREFIX + "ts:";
    public static final String KEY_PREFIX_SIGNAL = KEY_PREFIX + "signal:";
    public static final String KEY_PREFIX_JOB_DEDUP = KEY_PREFIX + "job:dedup:";
    public static final String KEY_PREFIX_LEASE = KEY_PREFIX + "lease:";

    public static final String KEY_SET_SIGNALS_ALL = KEY_PREFIX + "signals:all";

    public static final Duration DEFAULT_TTL = Duration.ofHours(24);
}
