package com.agentguard.exception;

/**
 * Malformed input, rejected before any rule runs. Nothing is recorded.
 */
public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    /** Throws if {@code value} is null or blank; returns it trimmed otherwise. */
    public static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " must not be empty");
        }
        return value.trim();
    }
}
