package com.signalengine.lease;

import com.signalengine.config.RedisConfig;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

/**
 * Cross-process {@link LeaseStore} on Redis.
 *
 * <p>Acquire is {@code SET sig:lease:{class} "{owner}|{acquiredAtMs}" NX PX ttl}; Redis
 * expiry makes an abandoned lease reclaimable. Release is a Lua script that deletes the key
 * only when its value starts with the caller's owner id.
 *
 * <p>Default store ({@code signalengine.lease.store=redis}).
 */
@Component
@ConditionalOnProperty(prefix = "signalengine.lease", name = "store", havingValue = "redis", matchIfMissing = true)
public class RedisLeaseStore implements LeaseStore {

    private static final Logger log = LoggerFactory.getLogger(RedisLeaseStore.class);

    private static final String SEPARATOR = "|";

    static final DefaultRedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "local v = redis.call('get', KEYS[1]) "
                    + "if v and string.sub(v, 1, string.len(ARGV[1])) == ARGV[1] then "
                    + "return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate stringRedisTemplate;
    private final Clock clock;
    private final LeaseOwner leaseOwner;

    public RedisLeaseStore(StringRedisTemplate stringRedisTemplate, Clock clock) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.clock = clock;
        this.leaseOwner = new LeaseOwner();
    }

    @Override
    public boolean tryAcquire(String workflowClass, Duration ttl) {
        String owner = leaseOwner.current();
        String value = owner + SEPARATOR + clock.millis();
        Boolean acquired = stringRedisTemplate.opsForValue().setIfAbsent(key(workflowClass), value, ttl);
        if (Boolean.TRUE.equals(acquired)) {
            log.info("Lease acquired: {} by {} for {}s", workflowClass, owner, ttl.toSeconds());
            return true;
        }
        return false;
    }

    @Override
    public void release(String workflowClass) {
        String owner = leaseOwner.current();
        // trailing separator so "p:1" never matches the value of owner "p:12"
        Long deleted = stringRedisTemplate.execute(RELEASE_SCRIPT, List.of(key(workflowClass)), owner + SEPARATOR);
        if (deleted != null && deleted > 0) {
            log.info("Lease released: {} by {}", workflowClass, owner);
        }
    }

    @Override
    public boolean isHeld(String workflowClass) {
        return Boolean.TRUE.equals(stringRedisTemplate.hasKey(key(workflowClass)));
    }

    @Override
    public Optional<ActiveWorkflowMarker> find(String workflowClass) {
        String key = key(workflowClass);
        String value = stringRedisTemplate.opsForValue().get(key);
        if (value == null) {
            return Optional.empty();
        }
        Long ttlMs = stringRedisTemplate.getExpire(key, TimeUnit.MILLISECONDS);
        if (ttlMs == null || ttlMs == -2) {
            // expired between GET and PTTL
            return Optional.empty();
        }

        Instant now = clock.instant();
        int separator = value.lastIndexOf(SEPARATOR);
        String owner = separator > 0 ? value.substring(0, separator) : value;
        Instant acquiredAt = now;
        if (separator > 0) {
            try {
                acquiredAt = Instant.ofEpochMilli(Long.parseLong(value.substring(separator + 1)));
            } catch (NumberFormatException e) {
                log.warn("Malformed lease value for {}: {}", workflowClass, value);
            }
        }
        // -1: no expiry set, treated as held until released
        Instant expiresAt = ttlMs >= 0 ? now.plusMillis(ttlMs) : Instant.MAX;
        return Optional.of(new ActiveWorkflowMarker(workflowClass, owner, acquiredAt, expiresAt));
    }

    private static String key(String workflowClass) {
        return RedisConfig.KEY_PREFIX_LEASE + workflowClass;
    }
}
