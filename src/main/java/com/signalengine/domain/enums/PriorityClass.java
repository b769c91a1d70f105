package com.signalengine.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Priority class of a job in the job queue.
 *
 * <p>Jobs are dequeued by level (lower = higher priority), then FIFO within a level.
 * Exclusive classes must hold the lease of their workflow class while they run; while
 * that lease is held the conflict arbiter pauses the competing worker classes.
 *
 * <ul>
 *   <li>MULTI_TIMEFRAME (0): multi-timeframe batch over an instrument group, exclusive</li>
 *   <li>BACKFILL (1): historical backfill of a newly activated instrument</li>
 *   <li>REALTIME (2): incremental realtime evaluation of one instrument</li>
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public enum PriorityClass {
    MULTI_TIMEFRAME(0, true),
    BACKFILL(1, false),
    REALTIME(2, false);

    private final int level;
    private final boolean exclusive;

    /** Lease name guarding this class when it is exclusive. */
    public String workflowClass() {
        return name();
    }
}
