package com.agentguard.service;

import com.agentguard.domain.enums.KillSwitchState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

/**
 * Creates the kill switch row on startup if it does not exist yet, using
 * {@code agentguard.kill-switch.initial-state}. An existing row is never overwritten, so
 * a flag set before a restart survives it.
 */
@Component
public class SystemStateInitializer implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(SystemStateInitializer.class);

    private final SystemStateService systemStateService;
    private final KillSwitchState initialState;

    public SystemStateInitializer(
            SystemStateService systemStateService,
            @Value("${agentguard.kill-switch.initial-state:disabled}") String initialState) {
        this.systemStateService = systemStateService;
        this.initialState = KillSwitchState.fromValue(initialState);
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        try {
            if (systemStateService.initializeIfAbsent(initialState)) {
                log.info("System kill switch initialized to {}", initialState.getValue());
            } else {
                log.info(
                        "System kill switch already present, current state {}",
                        systemStateService.currentState().getValue());
            }
        } catch (DataIntegrityViolationException e) {
            // Another instance inserted the row between our existence check and insert
            log.info("System kill switch row created concurrently by another instance");
        }
    }
}
