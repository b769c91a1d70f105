package com.signalengine.api.dto.request;

import com.signalengine.domain.enums.PipelineMode;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * On-demand pipeline run for one configured instrument. Runs on the request thread, outside
 * the job queues.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class EvaluateRequest {

    @NotBlank(message = "Venue is required")
    private String venue;

    @NotBlank(message = "Ticker is required")
    private String ticker;

    private PipelineMode mode = PipelineMode.REALTIME;
}
