package com.signalengine.event;

import com.signalengine.job.Job;
import com.signalengine.pipeline.RunSummary;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the dispatcher and the job runner on every job lifecycle change.
 *
 * <p>For {@link JobEventType#DUPLICATE_SKIPPED} no job was created; {@code job} is the
 * rejected candidate and was never enqueued.
 */
public class JobEvent extends ApplicationEvent {

    private final Job job;
    private final JobEventType eventType;
    private final String message;
    private final RunSummary summary;

    public JobEvent(Object source, Job job, JobEventType eventType, String message, RunSummary summary) {
        super(source);
        this.job = job;
        this.eventType = eventType;
        this.message = message;
        this.summary = summary;
    }

    public JobEvent(Object source, Job job, JobEventType eventType, String message) {
        this(source, job, eventType, message, null);
    }

    public JobEvent(Object source, Job job, JobEventType eventType) {
        this(source, job, eventType, null, null);
    }

    public Job getJob() {
        return job;
    }

    public JobEventType getEventType() {
        return eventType;
    }

    /** Failure or skip reason; null for ADMITTED, STARTED and COMPLETED. */
    public String getMessage() {
        return message;
    }

    /** Run summary; set for COMPLETED only. */
    public RunSummary getSummary() {
        return summary;
    }
}
