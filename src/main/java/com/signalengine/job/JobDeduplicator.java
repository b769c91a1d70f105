package com.signalengine.job;

import com.signalengine.config.RedisConfig;
import com.signalengine.exception.DuplicateJobException;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Service;

/**
 * Admits at most one job per dedupe key using Redis keys with a TTL.
 *
 * <p>The claim is a single {@code SET key jobId NX PX ttl}, so two dispatchers racing on the
 * same key cannot both win. The dispatcher claims for the job timeout plus the longest queue
 * wait, and the runner re-arms the claim to the job timeout when it starts the job, so a claim
 * whose job died without releasing it still expires on its own. Re-arm and release act only
 * while the key still holds the caller's job id.
 *
 * <p>Key schema: {@code sig:job:dedup:{dedupeKey}}
 */
@Service
public class JobDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(JobDeduplicator.class);

    public static final String KEY_PREFIX = RedisConfig.KEY_PREFIX_JOB_DEDUP;

    private static final DefaultRedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private static final DefaultRedisScript<Long> EXTEND_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('pexpire', KEYS[1], ARGV[2]) else return 0 end",
            Long.class);

    private final StringRedisTemplate stringRedisTemplate;

    public JobDeduplicator(StringRedisTemplate stringRedisTemplate) {
        this.stringRedisTemplate = stringRedisTemplate;
    }

    /**
     * Claims the key for the job.
     *
     * @throws DuplicateJobException if another job holds the key
     */
    public void claim(String dedupeKey, String jobId, Duration ttl) {
        Boolean claimed = stringRedisTemplate.opsForValue().setIfAbsent(KEY_PREFIX + dedupeKey, jobId, ttl);
        if (!Boolean.TRUE.equals(claimed)) {
            throw new DuplicateJobException(dedupeKey);
        }
        log.debug("Dedupe key claimed: {} -> {}", dedupeKey, jobId);
    }

    /** Resets the claim's TTL if the job still holds the key. */
    public boolean extend(String dedupeKey, String jobId, Duration ttl) {
        Long extended = stringRedisTemplate.execute(
                EXTEND_SCRIPT, List.of(KEY_PREFIX + dedupeKey), jobId, String.valueOf(ttl.toMillis()));
        boolean held = extended != null && extended > 0;
        if (!held) {
            log.warn("Dedupe key {} no longer held by {} at job start", dedupeKey, jobId);
        }
        return held;
    }

    /** Releases the key if the job still holds it. */
    public boolean release(String dedupeKey, String jobId) {
        Long deleted = stringRedisTemplate.execute(RELEASE_SCRIPT, List.of(KEY_PREFIX + dedupeKey), jobId);
        boolean released = deleted != null && deleted > 0;
        log.debug("Dedupe key {} release by {}: {}", dedupeKey, jobId, released);
        return released;
    }
}
