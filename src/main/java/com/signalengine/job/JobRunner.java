package com.signalengine.job;

import com.signalengine.domain.enums.PriorityClass;
import com.signalengine.event.EventPublisherHelper;
import com.signalengine.exception.JobTimeoutException;
import com.signalengine.lease.LeaseStore;
import com.signalengine.pipeline.PipelineExecutor;
import com.signalengine.pipeline.RunSummary;
import java.time.Clock;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Executes one polled job on behalf of a worker thread.
 *
 * <ol>
 *   <li>Claim the job (QUEUED → RUNNING). A lost claim means another worker has it. A won
 *       claim re-arms the dedupe key to the job timeout, ending the queue-wait allowance.</li>
 *   <li>For an exclusive priority class, take the workflow lease with the job timeout as
 *       TTL. If it is held elsewhere the job is SKIPPED.</li>
 *   <li>Run the pipeline on the pipeline executor and wait at most the job timeout. A timeout
 *       cancels the run and fails the job with {@link JobTimeoutException}.</li>
 *   <li>Always release the lease (if owned) and the dedupe claim.</li>
 * </ol>
 */
@Component
public class JobRunner {

    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    private final JobQueue jobQueue;
    private final JobDeduplicator jobDeduplicator;
    private final LeaseStore leaseStore;
    private final PipelineExecutor pipelineExecutor;
    private final AsyncTaskExecutor pipelineTaskExecutor;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public JobRunner(
            JobQueue jobQueue,
            JobDeduplicator jobDeduplicator,
            LeaseStore leaseStore,
            PipelineExecutor pipelineExecutor,
            @Qualifier("pipelineTaskExecutor") AsyncTaskExecutor pipelineTaskExecutor,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.jobQueue = jobQueue;
        this.jobDeduplicator = jobDeduplicator;
        this.leaseStore = leaseStore;
        this.pipelineExecutor = pipelineExecutor;
        this.pipelineTaskExecutor = pipelineTaskExecutor;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    public void execute(PrioritizedJob entry) {
        Job job = entry.getJob();
        JobHandle handle = job.handle();

        if (!jobQueue.claim(handle)) {
            log.debug("Job {} already claimed, ignoring", job.getId());
            return;
        }
        jobDeduplicator.extend(job.getDedupeKey(), job.getId(), job.getTimeout());

        PriorityClass priorityClass = job.getPriorityClass();
        boolean leaseHeld = false;
        try {
            if (priorityClass.isExclusive()) {
                leaseHeld = leaseStore.tryAcquire(priorityClass.workflowClass(), job.getTimeout());
                if (!leaseHeld) {
                    String reason = "lease " + priorityClass.workflowClass() + " held by another run";
                    jobQueue.markSkipped(handle, reason);
                    eventPublisherHelper.publishJobSkipped(this, job, reason);
                    log.info("Job {} skipped: {}", job.getId(), reason);
                    return;
                }
            }

            long queueLatency = clock.millis() - entry.getEnqueuedAt();
            log.info(
                    "Job started: id={}, queue={}, mode={}, instruments={}, queueLatency={}ms",
                    job.getId(),
                    job.getQueueName(),
                    job.getMode(),
                    job.getInstruments().size(),
                    queueLatency);
            eventPublisherHelper.publishJobStarted(this, job);

            runPipeline(job, handle);
        } finally {
            if (leaseHeld) {
                leaseStore.release(priorityClass.workflowClass());
            }
            jobDeduplicator.release(job.getDedupeKey(), job.getId());
        }
    }

    private void runPipeline(Job job, JobHandle handle) {
        Future<RunSummary> future;
        try {
            future = pipelineTaskExecutor.submit(() -> pipelineExecutor.runBatch(job.getInstruments(), job.getMode()));
        } catch (TaskRejectedException e) {
            fail(job, handle, "pipeline executor rejected the job: " + e.getMessage());
            return;
        }

        try {
            RunSummary summary = future.get(job.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            jobQueue.markDone(handle, summary);
            eventPublisherHelper.publishJobCompleted(this, job, summary);
            log.info(
                    "Job completed: id={}, processed={}, signals={}, failed={}",
                    job.getId(),
                    summary.getProcessed(),
                    summary.getSignalsGenerated(),
                    summary.getFailed());
        } catch (TimeoutException e) {
            future.cancel(true);
            JobTimeoutException timeout = new JobTimeoutException(job.getId(), job.getTimeout());
            jobQueue.markFailed(handle, timeout.getMessage());
            eventPublisherHelper.publishJobTimedOut(this, job, timeout.getMessage());
            log.warn("Job timed out: id={}, queue={}: {}", job.getId(), job.getQueueName(), timeout.getMessage());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Job failed: id={}, queue={}", job.getId(), job.getQueueName(), cause);
            fail(job, handle, cause.getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            fail(job, handle, "worker interrupted");
        }
    }

    private void fail(Job job, JobHandle handle, String reason) {
        jobQueue.markFailed(handle, reason);
        eventPublisherHelper.publishJobFailed(this, job, reason);
    }
}
