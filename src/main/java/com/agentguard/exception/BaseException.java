package com.agentguard.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Getter;

/**
 * Root of every error the engine reports to callers. The {@link ErrorCode} fixes the
 * HTTP status; {@code details} carries structured context such as the decision that won
 * a resolution race. Detail values may be null (e.g. an unset resolution time).
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public boolean hasDetails() {
        return !details.isEmpty();
    }
}
