package com.signalengine.job;

import com.signalengine.domain.enums.PipelineMode;
import com.signalengine.domain.enums.PriorityClass;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to run the pipeline over a group of instruments on a named queue.
 *
 * <p>Instruments are given by key ({@code VENUE:TICKER}) and must be configured.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobRequest {

    @NotBlank
    private String queueName;

    @NotEmpty
    private List<@NotBlank String> instruments;

    @NotNull
    private PipelineMode mode;

    @NotBlank
    private String dedupeKey;

    /** Defaults to {@link JobDispatcher#DEFAULT_TIMEOUT}. */
    private Duration timeout;

    /** Defaults to REALTIME. */
    private PriorityClass priorityClass;
}
