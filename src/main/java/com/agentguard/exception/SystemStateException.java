package com.agentguard.exception;

/**
 * Inconsistent or unavailable engine state (missing kill switch row).
 * Always surfaced to the caller; never converted into a fabricated verdict.
 */
public class SystemStateException extends BaseException {

    public SystemStateException(String message) {
        super(ErrorCode.SYSTEM_ERROR, message);
    }
}
