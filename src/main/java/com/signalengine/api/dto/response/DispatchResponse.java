package com.signalengine.api.dto.response;

import com.signalengine.job.DispatchResult;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DispatchResponse {

    private boolean admitted;
    private String jobId;
    private String queueName;
    private String dedupeKey;
    private String reason;

    public static DispatchResponse from(DispatchResult result) {
        return DispatchResponse.builder()
                .admitted(result.admitted())
                .jobId(result.handle() != null ? result.handle().jobId() : null)
                .queueName(result.handle() != null ? result.handle().queueName() : null)
                .dedupeKey(result.dedupeKey())
                .reason(result.reason())
                .build();
    }
}
