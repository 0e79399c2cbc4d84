package com.agentguard.api.dto.response;

import com.agentguard.api.filter.RequestTraceFilter;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.Getter;
import org.slf4j.MDC;

/**
 * Success envelope: {@code {success: true, data, timestamp, traceId}}. The trace id is
 * the one assigned to the current request, so a caller can quote it when asking about a
 * decision.
 */
@Getter
public class ApiResponse<T> {

    private final boolean success = true;
    private final T data;
    private final Instant timestamp;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final String traceId;

    private ApiResponse(T data, String traceId) {
        this.data = data;
        this.timestamp = Instant.now();
        this.traceId = traceId;
    }

    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(data, MDC.get(RequestTraceFilter.MDC_KEY));
    }
}
