package com.agentguard.exception;

/**
 * Caller is known but not allowed to perform the mutation, e.g. a non-owner trying to
 * disable an agent.
 */
public class ForbiddenException extends BaseException {

    public ForbiddenException(String message) {
        super(ErrorCode.FORBIDDEN, message);
    }
}
