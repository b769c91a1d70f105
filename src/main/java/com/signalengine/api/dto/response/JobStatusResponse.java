package com.signalengine.api.dto.response;

import com.signalengine.domain.enums.JobStatus;
import com.signalengine.domain.enums.PipelineMode;
import com.signalengine.domain.enums.PriorityClass;
import com.signalengine.domain.model.Instrument;
import com.signalengine.job.Job;
import com.signalengine.job.JobRecord;
import com.signalengine.pipeline.RunSummary;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Status of a job as kept by its queue. {@code summary} is set once the job is DONE;
 * {@code error} once it FAILED or was SKIPPED.
 */
@Data
@Builder
public class JobStatusResponse {

    private String jobId;
    private String queueName;
    private JobStatus status;
    private PipelineMode mode;
    private PriorityClass priorityClass;
    private List<String> instruments;
    private String dedupeKey;
    private Instant enqueuedAt;
    private Instant startedAt;
    private Instant finishedAt;
    private String error;
    private RunSummary summary;

    public static JobStatusResponse from(JobRecord record) {
        Job job = record.getJob();
        return JobStatusResponse.builder()
                .jobId(job.getId())
                .queueName(job.getQueueName())
                .status(record.getStatus())
                .mode(job.getMode())
                .priorityClass(job.getPriorityClass())
                .instruments(job.getInstruments().stream().map(Instrument::key).toList())
                .dedupeKey(job.getDedupeKey())
                .enqueuedAt(record.getEnqueuedAt())
                .startedAt(record.getStartedAt())
                .finishedAt(record.getFinishedAt())
                .error(record.getError())
                .summary(record.getSummary())
                .build();
    }
}
