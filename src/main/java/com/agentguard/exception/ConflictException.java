package com.agentguard.exception;

import java.util.Map;

/**
 * The requested transition is no longer possible because the state already moved on.
 * Details describe the existing state so the caller knows what was decided and by whom.
 */
public class ConflictException extends BaseException {

    public ConflictException(String message, Map<String, Object> details) {
        super(ErrorCode.CONFLICT, message, details);
    }
}
