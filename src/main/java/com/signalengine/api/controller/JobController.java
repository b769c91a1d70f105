package com.signalengine.api.controller;

import com.signalengine.api.dto.response.DispatchResponse;
import com.signalengine.api.dto.response.JobStatusResponse;
import com.signalengine.exception.ResourceNotFoundException;
import com.signalengine.job.DispatchResult;
import com.signalengine.job.JobDispatcher;
import com.signalengine.job.JobHandle;
import com.signalengine.job.JobQueue;
import com.signalengine.job.JobRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for pipeline jobs.
 *
 * <ul>
 *   <li>POST /api/jobs -- dispatch a job; 202 when admitted, 200 with {@code admitted=false}
 *       when its dedupe key is already held</li>
 *   <li>GET /api/jobs/{queue}/{jobId} -- job status and, once finished, its run summary</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/jobs")
public class JobController {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private final JobDispatcher jobDispatcher;
    private final JobQueue jobQueue;

    public JobController(JobDispatcher jobDispatcher, JobQueue jobQueue) {
        this.jobDispatcher = jobDispatcher;
        this.jobQueue = jobQueue;
    }

    @PostMapping
    public ResponseEntity<DispatchResponse> dispatch(@Valid @RequestBody JobRequest request) {
        log.info(
                "Job dispatch requested: queue={}, mode={}, instruments={}",
                request.getQueueName(),
                request.getMode(),
                request.getInstruments().size());
        DispatchResult result = jobDispatcher.dispatch(request);
        HttpStatus status = result.admitted() ? HttpStatus.ACCEPTED : HttpStatus.OK;
        return ResponseEntity.status(status).body(DispatchResponse.from(result));
    }

    @GetMapping("/{queueName}/{jobId}")
    public ResponseEntity<JobStatusResponse> getJob(@PathVariable String queueName, @PathVariable String jobId) {
        JobHandle handle = new JobHandle(jobId, queueName);
        return jobQueue.find(handle)
                .map(JobStatusResponse::from)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> ResourceNotFoundException.job(queueName, jobId));
    }
}
