package com.signalengine.lease;

import java.time.Duration;
import java.util.Optional;

/**
 * Time-bounded exclusivity claims per workflow class.
 *
 * <p>Acquire is acquire-if-absent and release is release-if-owner, each a single atomic
 * operation. The owner is the store instance's process-wide owner id combined with the
 * acquiring thread, so a release from a thread that does not hold the lease is a no-op.
 * An expired lease is free: the next {@link #tryAcquire} takes it.
 */
public interface LeaseStore {

    boolean tryAcquire(String workflowClass, Duration ttl);

    /** Releases the lease if the calling owner holds it. */
    void release(String workflowClass);

    boolean isHeld(String workflowClass);

    /** The current unexpired holder, if any. */
    Optional<ActiveWorkflowMarker> find(String workflowClass);
}
