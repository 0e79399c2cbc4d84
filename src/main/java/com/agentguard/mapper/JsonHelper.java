package com.agentguard.mapper;

import com.agentguard.domain.model.TraceEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decision trace codec shared by the MapStruct mappers and the resolution update.
 *
 * <p>Traces live in TEXT columns on pending_requests and audit_logs as JSON arrays using
 * the same field names as the API ({@code rule_checked}, {@code rule_result},
 * {@code notes}). A trace that cannot be read means the row is corrupt, so the failure is
 * raised instead of being replaced with an empty trace.
 */
public final class JsonHelper {

    private static final Logger log = LoggerFactory.getLogger(JsonHelper.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final JavaType TRACE_TYPE =
            OBJECT_MAPPER.getTypeFactory().constructCollectionType(List.class, TraceEntry.class);

    private JsonHelper() {}

    /** Null stays null so an absent trace is stored as SQL NULL. */
    public static String writeTrace(List<TraceEntry> trace) {
        if (trace == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writerFor(TRACE_TYPE).writeValueAsString(trace);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Decision trace could not be serialized", e);
        }
    }

    /** A NULL or blank column reads as an empty trace. */
    public static List<TraceEntry> readTrace(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return OBJECT_MAPPER.readValue(json, TRACE_TYPE);
        } catch (JsonProcessingException e) {
            log.error("Stored decision trace is not valid JSON: {}", json, e);
            throw new IllegalStateException("Stored decision trace is corrupt", e);
        }
    }
}
