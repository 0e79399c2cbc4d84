package com.agentguard.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Time sources for the decision engine.
 *
 * <p>All persisted timestamps are UTC. Time-of-day permission conditions are read in
 * {@code agentguard.condition.zone-id} (default UTC).
 */
@Configuration
public class GuardConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ZoneId conditionZone(@Value("${agentguard.condition.zone-id:UTC}") String zoneId) {
        return ZoneId.of(zoneId);
    }
}
