package com.signalengine.api.controller;

import com.signalengine.api.dto.response.SchedulerStateResponse;
import com.signalengine.job.JobQueue;
import com.signalengine.job.WorkerClassControl;
import com.signalengine.lease.ActiveWorkflowMarker;
import com.signalengine.scheduler.ConflictArbiter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Read-only view of the arbiter and queue state: GET /api/scheduler/state. */
@RestController
@RequestMapping("/api/scheduler")
public class SchedulerController {

    private final ConflictArbiter conflictArbiter;
    private final WorkerClassControl workerClassControl;
    private final JobQueue jobQueue;

    public SchedulerController(
            ConflictArbiter conflictArbiter, WorkerClassControl workerClassControl, JobQueue jobQueue) {
        this.conflictArbiter = conflictArbiter;
        this.workerClassControl = workerClassControl;
        this.jobQueue = jobQueue;
    }

    @GetMapping("/state")
    public ResponseEntity<SchedulerStateResponse> getState() {
        Optional<ActiveWorkflowMarker> marker = conflictArbiter.activeMarker();

        Map<String, Integer> depths = new LinkedHashMap<>();
        jobQueue.queueNames().stream().sorted().forEach(name -> depths.put(name, jobQueue.size(name)));

        return ResponseEntity.ok(SchedulerStateResponse.builder()
                .highPriorityClass(conflictArbiter.getHighPriorityClass().workflowClass())
                .highPriorityActive(marker.isPresent())
                .leaseOwner(marker.map(ActiveWorkflowMarker::ownerId).orElse(null))
                .leaseExpiresAt(marker.map(ActiveWorkflowMarker::expiresAt).orElse(null))
                .pausedWorkerClasses(workerClassControl.pausedClasses())
                .queueDepths(depths)
                .build());
    }
}
