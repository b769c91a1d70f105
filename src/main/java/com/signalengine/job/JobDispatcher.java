package com.signalengine.job;

import com.signalengine.config.SignalEngineProperties;
import com.signalengine.domain.enums.PriorityClass;
import com.signalengine.domain.model.Instrument;
import com.signalengine.event.EventPublisherHelper;
import com.signalengine.exception.DuplicateJobException;
import com.signalengine.exception.ResourceNotFoundException;
import com.signalengine.policy.ConfigRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Admits job requests onto the job queue.
 *
 * <p>The dedupe key is claimed in Redis before enqueueing, for the job timeout plus
 * {@code jobs.max-queue-wait}. The queue itself also refuses a key whose job is still
 * unfinished. A request rejected by either is dropped and reported as
 * {@code skip: duplicate}; it is not an error for the caller.
 */
@Service
public class JobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(300);

    private final JobQueue jobQueue;
    private final JobDeduplicator jobDeduplicator;
    private final ConfigRegistry configRegistry;
    private final EventPublisherHelper eventPublisherHelper;
    private final Duration maxQueueWait;

    public JobDispatcher(
            JobQueue jobQueue,
            JobDeduplicator jobDeduplicator,
            ConfigRegistry configRegistry,
            EventPublisherHelper eventPublisherHelper,
            SignalEngineProperties properties) {
        this.jobQueue = jobQueue;
        this.jobDeduplicator = jobDeduplicator;
        this.configRegistry = configRegistry;
        this.eventPublisherHelper = eventPublisherHelper;
        this.maxQueueWait = properties.getJobs().getMaxQueueWait();
    }

    /**
     * @throws ResourceNotFoundException if the queue or an instrument is not configured
     */
    public DispatchResult dispatch(JobRequest request) {
        if (!jobQueue.queueNames().contains(request.getQueueName())) {
            throw ResourceNotFoundException.queue(request.getQueueName());
        }

        Job job = Job.builder()
                .id(UUID.randomUUID().toString())
                .queueName(request.getQueueName())
                .instruments(resolveInstruments(request.getInstruments()))
                .mode(request.getMode())
                .dedupeKey(request.getDedupeKey())
                .timeout(request.getTimeout() != null ? request.getTimeout() : DEFAULT_TIMEOUT)
                .priorityClass(request.getPriorityClass() != null ? request.getPriorityClass() : PriorityClass.REALTIME)
                .build();

        try {
            jobDeduplicator.claim(job.getDedupeKey(), job.getId(), job.getTimeout().plus(maxQueueWait));
        } catch (DuplicateJobException e) {
            return duplicate(job);
        }

        JobHandle handle;
        try {
            handle = jobQueue.enqueue(job);
        } catch (DuplicateJobException e) {
            jobDeduplicator.release(job.getDedupeKey(), job.getId());
            return duplicate(job);
        } catch (RuntimeException e) {
            jobDeduplicator.release(job.getDedupeKey(), job.getId());
            throw e;
        }

        eventPublisherHelper.publishJobAdmitted(this, job);
        log.info(
                "Job admitted: id={}, queue={}, mode={}, priority={}, instruments={}",
                job.getId(),
                job.getQueueName(),
                job.getMode(),
                job.getPriorityClass(),
                job.getInstruments().size());
        return DispatchResult.admitted(handle, job.getDedupeKey());
    }

    private DispatchResult duplicate(Job job) {
        log.debug("skip: duplicate dedupeKey={} queue={}", job.getDedupeKey(), job.getQueueName());
        eventPublisherHelper.publishJobDuplicateSkipped(this, job);
        return DispatchResult.duplicate(job.getDedupeKey());
    }

    private List<Instrument> resolveInstruments(List<String> instrumentKeys) {
        List<Instrument> instruments = new ArrayList<>(instrumentKeys.size());
        for (String instrumentKey : instrumentKeys) {
            int separator = instrumentKey.indexOf(':');
            if (separator <= 0 || separator == instrumentKey.length() - 1) {
                throw new ResourceNotFoundException("Instrument", instrumentKey);
            }
            instruments.add(configRegistry
                    .findInstrument(instrumentKey.substring(0, separator), instrumentKey.substring(separator + 1))
                    .orElseThrow(() -> new ResourceNotFoundException("Instrument", instrumentKey)));
        }
        return List.copyOf(instruments);
    }
}
