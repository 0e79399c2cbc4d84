package com.agentguard.api.dto.response;

import com.agentguard.api.filter.RequestTraceFilter;
import com.agentguard.exception.ErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import org.slf4j.MDC;

/**
 * Error envelope for every failed request: {@code {success: false, error: {...}}}.
 * {@code details} is omitted unless the failure carries structured context.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(ErrorDetail.builder()
                .code(errorCode.getCode())
                .message(message)
                .details(details)
                .path(path)
                .traceId(MDC.get(RequestTraceFilter.MDC_KEY))
                .timestamp(Instant.now())
                .build());
    }

    @Getter
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorDetail {
        private final String code;
        private final String message;
        private final Map<String, Object> details;
        private final String path;
        private final String traceId;
        private final Instant timestamp;
    }
}
