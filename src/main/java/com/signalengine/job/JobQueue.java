package com.signalengine.job;

import com.signalengine.domain.enums.JobStatus;
import com.signalengine.pipeline.RunSummary;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Named priority queues of pipeline jobs plus the status table of every job they held.
 *
 * <p>A job id is processed by at most one worker: a worker must {@link #claim} a polled job
 * before running it, and only one claim per job succeeds. The queue does not prevent two
 * different jobs from targeting the same instrument.
 */
public interface JobQueue {

    /**
     * @throws com.signalengine.exception.ResourceNotFoundException if the queue is not configured
     * @throws com.signalengine.exception.DuplicateJobException if an unfinished job with the same
     *     dedupe key is still queued or running
     */
    JobHandle enqueue(Job job);

    /** The queued or running job holding the dedupe key, if any. */
    Optional<JobHandle> findUnfinished(String dedupeKey);

    /**
     * @throws com.signalengine.exception.ResourceNotFoundException if the job is unknown or its record expired
     */
    JobStatus status(JobHandle handle);

    /** Summary of a finished job; empty while queued or running, or if the job produced none. */
    Optional<RunSummary> result(JobHandle handle);

    Optional<JobRecord> find(JobHandle handle);

    /**
     * Removes the next job of the queue, waiting up to {@code timeout}.
     *
     * @return empty if nothing arrived in time
     */
    Optional<PrioritizedJob> poll(String queueName, Duration timeout) throws InterruptedException;

    /** QUEUED → RUNNING. False if another worker already claimed the job. */
    boolean claim(JobHandle handle);

    void markDone(JobHandle handle, RunSummary summary);

    void markFailed(JobHandle handle, String error);

    void markSkipped(JobHandle handle, String reason);

    Set<String> queueNames();

    int size(String queueName);
}
