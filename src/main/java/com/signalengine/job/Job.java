package com.signalengine.job;

import com.signalengine.domain.enums.PipelineMode;
import com.signalengine.domain.enums.PriorityClass;
import com.signalengine.domain.model.Instrument;
import java.time.Duration;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * A unit of pipeline work: run {@code mode} over {@code instruments} within {@code timeout}.
 *
 * <p>{@code dedupeKey} is claimed by the dispatcher before the job is admitted and released
 * when the job finishes; a second request with the same key in between is dropped.
 */
@Value
@Builder
public class Job {

    String id;

    String queueName;

    List<Instrument> instruments;

    PipelineMode mode;

    String dedupeKey;

    Duration timeout;

    PriorityClass priorityClass;

    public JobHandle handle() {
        return new JobHandle(id, queueName);
    }
}
