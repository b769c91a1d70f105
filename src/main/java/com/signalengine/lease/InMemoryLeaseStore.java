package com.signalengine.lease;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Single-process {@link LeaseStore}. Every mutation runs inside
 * {@link ConcurrentHashMap#compute}, which makes acquire-if-absent and release-if-owner atomic
 * per workflow class.
 *
 * <p>Selected with {@code signalengine.lease.store=memory}; only safe when one engine
 * process runs against the job queue.
 */
@Component
@ConditionalOnProperty(prefix = "signalengine.lease", name = "store", havingValue = "memory")
public class InMemoryLeaseStore implements LeaseStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryLeaseStore.class);

    private final Map<String, ActiveWorkflowMarker> leases = new ConcurrentHashMap<>();
    private final Clock clock;
    private final LeaseOwner leaseOwner;

    public InMemoryLeaseStore(Clock clock) {
        this.clock = clock;
        this.leaseOwner = new LeaseOwner();
    }

    @Override
    public boolean tryAcquire(String workflowClass, Duration ttl) {
        String owner = leaseOwner.current();
        Instant now = clock.instant();
        ActiveWorkflowMarker acquired = new ActiveWorkflowMarker(workflowClass, owner, now, now.plus(ttl));

        ActiveWorkflowMarker result = leases.compute(workflowClass, (key, existing) ->
                existing == null || existing.isExpired(now) ? acquired : existing);

        boolean won = result == acquired;
        if (won) {
            log.info("Lease acquired: {} by {} until {}", workflowClass, owner, acquired.expiresAt());
        }
        return won;
    }

    @Override
    public void release(String workflowClass) {
        String owner = leaseOwner.current();
        boolean[] released = new boolean[1];
        leases.computeIfPresent(workflowClass, (key, existing) -> {
            if (existing.ownerId().equals(owner)) {
                released[0] = true;
                return null;
            }
            return existing;
        });
        if (released[0]) {
            log.info("Lease released: {} by {}", workflowClass, owner);
        }
    }

    @Override
    public boolean isHeld(String workflowClass) {
        return find(workflowClass).isPresent();
    }

    @Override
    public Optional<ActiveWorkflowMarker> find(String workflowClass) {
        ActiveWorkflowMarker marker = leases.get(workflowClass);
        if (marker == null || marker.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(marker);
    }
}
