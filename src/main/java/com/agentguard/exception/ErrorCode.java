package com.agentguard.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    FORBIDDEN("FORBIDDEN", 403),
    NOT_FOUND("NOT_FOUND", 404),
    CONFLICT("CONFLICT", 409),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    SYSTEM_ERROR("SYSTEM_ERROR", 500);

    private final String code;
    private final int httpStatus;
}
