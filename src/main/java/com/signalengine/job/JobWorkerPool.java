package com.signalengine.job;

import com.signalengine.config.SignalEngineProperties;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Consumer threads draining the job queues: {@code signalengine.queues.<name>} threads per
 * queue.
 *
 * <p>Each thread polls its queue with a short timeout so that it notices both shutdown and a
 * pause of its worker class. A paused class takes no new jobs until resumed; a job already
 * running when the pause arrives finishes normally.
 */
@Component
public class JobWorkerPool implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(JobWorkerPool.class);

    private final JobQueue jobQueue;
    private final JobRunner jobRunner;
    private final WorkerClassControl workerClassControl;
    private final Map<String, Integer> workersPerQueue;
    private final Duration pollInterval;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final List<Thread> workers = new ArrayList<>();

    public JobWorkerPool(
            JobQueue jobQueue,
            JobRunner jobRunner,
            WorkerClassControl workerClassControl,
            SignalEngineProperties properties) {
        this.jobQueue = jobQueue;
        this.jobRunner = jobRunner;
        this.workerClassControl = workerClassControl;
        this.workersPerQueue = Map.copyOf(properties.getQueues());
        this.pollInterval = properties.getJobs().getPollInterval();
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            workersPerQueue.forEach((queueName, count) -> {
                for (int i = 0; i < count; i++) {
                    Thread worker = new Thread(() -> workLoop(queueName), "worker-" + queueName + "-" + i);
                    worker.setDaemon(true);
                    workers.add(worker);
                    worker.start();
                }
            });
            log.info("JobWorkerPool started: {}", workersPerQueue);
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            workers.forEach(Thread::interrupt);
            workers.clear();
            log.info("JobWorkerPool stopping");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // before the scheduler loops, which feed the queues
        return 0;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    private void workLoop(String queueName) {
        while (running.get()) {
            try {
                if (workerClassControl.isPaused(queueName)) {
                    Thread.sleep(pollInterval.toMillis());
                    continue;
                }
                Optional<PrioritizedJob> entry = jobQueue.poll(queueName, pollInterval);
                if (entry.isPresent()) {
                    jobRunner.execute(entry.get());
                }
            } catch (InterruptedException e) {
                if (!running.get()) {
                    log.debug("Worker for {} interrupted during shutdown", queueName);
                    Thread.currentThread().interrupt();
                    break;
                }
                log.warn("Worker for {} interrupted unexpectedly, resuming", queueName);
            } catch (RuntimeException e) {
                log.error("Worker for {} failed on a job, continuing", queueName, e);
            }
        }
    }
}
