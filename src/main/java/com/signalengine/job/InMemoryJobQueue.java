package com.signalengine.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.signalengine.config.SignalEngineProperties;
import com.signalengine.domain.enums.JobStatus;
import com.signalengine.exception.DuplicateJobException;
import com.signalengine.exception.ResourceNotFoundException;
import com.signalengine.pipeline.RunSummary;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-process {@link JobQueue}: one {@link PriorityBlockingQueue} per configured queue name.
 *
 * <p>Entries are ordered by priority level (MULTI_TIMEFRAME before BACKFILL before REALTIME),
 * then by a global sequence number for FIFO within a level. Queues are unbounded; job volume
 * is bounded by dedupe keys and the dispatch cadence.
 *
 * <p>An index of unfinished jobs by dedupe key makes {@link #enqueue} refuse a second job for a
 * key whose job is still QUEUED or RUNNING, however long it waits. Entries leave the index
 * when the job finishes or its record expires.
 *
 * <p>Job records live in a Caffeine cache that expires them {@code jobs.record-retention}
 * after their last write, so finished jobs do not accumulate.
 */
@Component
public class InMemoryJobQueue implements JobQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryJobQueue.class);

    private static final int INITIAL_CAPACITY = 64;

    private static final Comparator<PrioritizedJob> ORDER = Comparator.<PrioritizedJob>comparingInt(
                    entry -> entry.getPriority().getLevel())
            .thenComparingLong(PrioritizedJob::getSequenceNumber);

    private final AtomicLong sequenceCounter = new AtomicLong(0);
    private final Map<String, PriorityBlockingQueue<PrioritizedJob>> queues;
    private final Cache<String, JobRecord> records;
    private final Map<String, JobHandle> unfinishedByDedupeKey = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryJobQueue(SignalEngineProperties properties, Clock clock) {
        Map<String, PriorityBlockingQueue<PrioritizedJob>> byName = new LinkedHashMap<>();
        for (String name : properties.getQueues().keySet()) {
            byName.put(name, new PriorityBlockingQueue<>(INITIAL_CAPACITY, ORDER));
        }
        this.queues = Collections.unmodifiableMap(byName);
        this.records = Caffeine.newBuilder()
                .expireAfterWrite(properties.getJobs().getRecordRetention())
                .build();
        this.clock = clock;
    }

    @Override
    public JobHandle enqueue(Job job) {
        PriorityBlockingQueue<PrioritizedJob> queue = queue(job.getQueueName());

        PrioritizedJob entry = PrioritizedJob.builder()
                .job(job)
                .priority(job.getPriorityClass())
                .sequenceNumber(sequenceCounter.incrementAndGet())
                .enqueuedAt(clock.millis())
                .build();

        unfinishedByDedupeKey.compute(job.getDedupeKey(), (key, holder) -> {
            if (holder != null && isUnfinished(holder)) {
                throw new DuplicateJobException(key);
            }
            return job.handle();
        });
        records.put(recordKey(job.handle()), new JobRecord(job, clock.instant()));
        queue.put(entry);
        log.debug(
                "Job enqueued: id={}, queue={}, priority={}, mode={}, queueSize={}",
                job.getId(),
                job.getQueueName(),
                job.getPriorityClass(),
                job.getMode(),
                queue.size());
        return job.handle();
    }

    @Override
    public Optional<JobHandle> findUnfinished(String dedupeKey) {
        return Optional.ofNullable(unfinishedByDedupeKey.get(dedupeKey)).filter(this::isUnfinished);
    }

    @Override
    public JobStatus status(JobHandle handle) {
        return find(handle)
                .map(JobRecord::getStatus)
                .orElseThrow(() -> ResourceNotFoundException.job(handle.queueName(), handle.jobId()));
    }

    @Override
    public Optional<RunSummary> result(JobHandle handle) {
        return find(handle).map(JobRecord::getSummary);
    }

    @Override
    public Optional<JobRecord> find(JobHandle handle) {
        return Optional.ofNullable(records.getIfPresent(recordKey(handle)));
    }

    @Override
    public Optional<PrioritizedJob> poll(String queueName, Duration timeout) throws InterruptedException {
        return Optional.ofNullable(queue(queueName).poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    @Override
    public boolean claim(JobHandle handle) {
        JobRecord record = records.getIfPresent(recordKey(handle));
        return record != null && record.claim(clock.instant());
    }

    @Override
    public void markDone(JobHandle handle, RunSummary summary) {
        finish(handle, JobStatus.DONE, summary, null);
    }

    @Override
    public void markFailed(JobHandle handle, String error) {
        finish(handle, JobStatus.FAILED, null, error);
    }

    @Override
    public void markSkipped(JobHandle handle, String reason) {
        finish(handle, JobStatus.SKIPPED, null, reason);
    }

    @Override
    public Set<String> queueNames() {
        return queues.keySet();
    }

    @Override
    public int size(String queueName) {
        return queue(queueName).size();
    }

    private void finish(JobHandle handle, JobStatus status, RunSummary summary, String error) {
        String key = recordKey(handle);
        JobRecord record = records.getIfPresent(key);
        if (record == null) {
            log.warn("No record for finished job {} ({})", handle.jobId(), status);
            return;
        }
        record.finish(status, summary, error, clock.instant());
        unfinishedByDedupeKey.remove(record.getJob().getDedupeKey(), handle);
        // refresh the expiry window from the finish time
        records.put(key, record);
    }

    private boolean isUnfinished(JobHandle handle) {
        JobRecord record = records.getIfPresent(recordKey(handle));
        return record != null && !record.getStatus().isFinished();
    }

    private PriorityBlockingQueue<PrioritizedJob> queue(String queueName) {
        PriorityBlockingQueue<PrioritizedJob> queue = queues.get(queueName);
        if (queue == null) {
            throw ResourceNotFoundException.queue(queueName);
        }
        return queue;
    }

    private static String recordKey(JobHandle handle) {
        return handle.queueName() + "/" + handle.jobId();
    }
}
