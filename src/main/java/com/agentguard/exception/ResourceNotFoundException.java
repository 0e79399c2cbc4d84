package com.agentguard.exception;

import java.util.Map;

/**
 * An id supplied by the caller names no agent or pending request. The id is echoed under
 * the same key the request used ({@code agent_id}, {@code request_id}).
 */
public class ResourceNotFoundException extends BaseException {

    private ResourceNotFoundException(String message, String idField, String id) {
        super(ErrorCode.NOT_FOUND, message, Map.of(idField, id));
    }

    public static ResourceNotFoundException agent(String agentId) {
        return new ResourceNotFoundException("Agent " + agentId + " not found", "agent_id", agentId);
    }

    public static ResourceNotFoundException pendingRequest(String requestId) {
        return new ResourceNotFoundException("Pending request " + requestId + " not found", "request_id", requestId);
    }
}
