package com.signalengine.exception;

import java.util.Map;
import lombok.Getter;

/**
 * A queue, instrument, job or stored signal the request names does not exist. The resource
 * type and identifier are returned in {@code error.details}.
 */
@Getter
public class ResourceNotFoundException extends BaseException {

    private final String resourceType;
    private final String identifier;

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(
                ErrorCode.NOT_FOUND,
                String.format("%s %s is not configured or has no data", resourceType, identifier),
                Map.of("resourceType", resourceType, "identifier", identifier));
        this.resourceType = resourceType;
        this.identifier = identifier;
    }

    public static ResourceNotFoundException instrument(String venue, String ticker) {
        return new ResourceNotFoundException("Instrument", venue + ":" + ticker);
    }

    public static ResourceNotFoundException queue(String queueName) {
        return new ResourceNotFoundException("Queue", queueName);
    }

    public static ResourceNotFoundException job(String queueName, String jobId) {
        return new ResourceNotFoundException("Job", queueName + "/" + jobId);
    }

    public static ResourceNotFoundException signal(String instrumentKey) {
        return new ResourceNotFoundException("Signal", instrumentKey);
    }
}
