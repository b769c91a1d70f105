package com.signalengine.api.dto.response;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SchedulerStateResponse {

    private String highPriorityClass;
    private boolean highPriorityActive;
    private String leaseOwner;
    private Instant leaseExpiresAt;
    private Set<String> pausedWorkerClasses;
    private Map<String, Integer> queueDepths;
}
