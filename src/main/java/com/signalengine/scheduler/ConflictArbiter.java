package com.signalengine.scheduler;

import com.signalengine.config.SignalEngineProperties;
import com.signalengine.domain.enums.PriorityClass;
import com.signalengine.job.WorkerClassControl;
import com.signalengine.lease.ActiveWorkflowMarker;
import com.signalengine.lease.LeaseStore;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Pauses the competing worker classes while the high-priority workflow class holds its lease,
 * and resumes them once the lease is gone or expired.
 *
 * <p>{@link #tick()} is driven by a {@link CadenceLoop} (default every 60s) and does no
 * waiting of its own. Pause and resume are logged on transitions only.
 */
@Component
public class ConflictArbiter {

    private static final Logger log = LoggerFactory.getLogger(ConflictArbiter.class);

    private final LeaseStore leaseStore;
    private final WorkerClassControl workerClassControl;
    private final Clock clock;
    private final PriorityClass highPriorityClass;
    private final List<String> competingWorkerClasses;

    public ConflictArbiter(
            LeaseStore leaseStore,
            WorkerClassControl workerClassControl,
            SignalEngineProperties properties,
            Clock clock) {
        this.leaseStore = leaseStore;
        this.workerClassControl = workerClassControl;
        this.clock = clock;
        this.highPriorityClass = properties.getScheduler().getHighPriorityClass();
        this.competingWorkerClasses = List.copyOf(properties.getScheduler().getCompetingWorkerClasses());
    }

    /**
     * One arbitration step.
     *
     * @return true if the high-priority class is active and the competing classes are paused
     */
    public boolean tick() {
        Optional<ActiveWorkflowMarker> marker = activeMarker();

        if (marker.isPresent()) {
            for (String workerClass : competingWorkerClasses) {
                if (workerClassControl.pause(workerClass)) {
                    log.info(
                            "Pausing worker class {}: {} active (owner={}, expires={})",
                            workerClass,
                            highPriorityClass.workflowClass(),
                            marker.get().ownerId(),
                            marker.get().expiresAt());
                }
            }
            return true;
        }

        for (String workerClass : competingWorkerClasses) {
            if (workerClassControl.resume(workerClass)) {
                log.info("Resuming worker class {}: {} inactive", workerClass, highPriorityClass.workflowClass());
            }
        }
        return false;
    }

    public Optional<ActiveWorkflowMarker> activeMarker() {
        return leaseStore.find(highPriorityClass.workflowClass()).filter(m -> !m.isExpired(clock.instant()));
    }

    public PriorityClass getHighPriorityClass() {
        return highPriorityClass;
    }

    public List<String> getCompetingWorkerClasses() {
        return competingWorkerClasses;
    }
}
