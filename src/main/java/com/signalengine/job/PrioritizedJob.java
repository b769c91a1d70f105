package com.signalengine.job;

import com.signalengine.domain.enums.PriorityClass;
import lombok.Builder;
import lombok.Value;

/**
 * Queue entry wrapping a {@link Job} with its ordering keys: priority level first, then the
 * enqueue sequence for FIFO within a level.
 */
@Value
@Builder
public class PrioritizedJob {

    Job job;

    PriorityClass priority;

    /** Monotonic across all queues. */
    long sequenceNumber;

    /** Epoch millis, for queue latency logging. */
    long enqueuedAt;
}
