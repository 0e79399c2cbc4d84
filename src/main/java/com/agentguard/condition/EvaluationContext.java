package com.agentguard.condition;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import lombok.Value;

/**
 * Inputs a permission condition may refer to. Currently only the evaluation instant,
 * read in the configured zone.
 */
@Value
public class EvaluationContext {

    Instant evaluatedAt;

    ZoneId zone;

    public LocalTime localTime() {
        return evaluatedAt.atZone(zone).toLocalTime();
    }
}
