package com.signalengine.job;

import com.signalengine.domain.enums.JobStatus;
import com.signalengine.pipeline.RunSummary;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Status and outcome of a job, kept by the queue after the job leaves it.
 *
 * <p>The only transition that can race is QUEUED → RUNNING (two workers could see the same
 * entry after a re-enqueue), so it is a compare-and-set. Later transitions are made by the
 * single worker that won the claim.
 */
public class JobRecord {

    private final Job job;
    private final Instant enqueuedAt;
    private final AtomicReference<JobStatus> status = new AtomicReference<>(JobStatus.QUEUED);

    private volatile Instant startedAt;
    private volatile Instant finishedAt;
    private volatile RunSummary summary;
    private volatile String error;

    JobRecord(Job job, Instant enqueuedAt) {
        this.job = job;
        this.enqueuedAt = enqueuedAt;
    }

    boolean claim(Instant now) {
        if (status.compareAndSet(JobStatus.QUEUED, JobStatus.RUNNING)) {
            startedAt = now;
            return true;
        }
        return false;
    }

    void finish(JobStatus finalStatus, RunSummary runSummary, String errorMessage, Instant now) {
        this.summary = runSummary;
        this.error = errorMessage;
        this.finishedAt = now;
        status.set(finalStatus);
    }

    public Job getJob() {
        return job;
    }

    public JobStatus getStatus() {
        return status.get();
    }

    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public RunSummary getSummary() {
        return summary;
    }

    public String getError() {
        return error;
    }
}
