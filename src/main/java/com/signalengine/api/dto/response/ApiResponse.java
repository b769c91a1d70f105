package com.signalengine.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Collection;
import lombok.Getter;

/**
 * Success envelope. {@code count} is set when the payload is a collection, such as the
 * signal list.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private final boolean success;
    private final T data;
    private final Integer count;
    private final Instant timestamp;

    private ApiResponse(T data, Instant timestamp) {
        this.success = true;
        this.data = data;
        this.count = data instanceof Collection<?> items ? items.size() : null;
        this.timestamp = timestamp;
    }

    public static <T> ApiResponse<T> of(T data, Instant timestamp) {
        return new ApiResponse<>(data, timestamp);
    }
}
