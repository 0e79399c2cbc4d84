package com.agentguard.observability;

import com.agentguard.domain.enums.PendingStatus;
import com.agentguard.event.DecisionEvent;
import com.agentguard.repository.jpa.PendingRequestJpaRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the decision engine, fed by {@link DecisionEvent}s.
 * <ul>
 *   <li><b>agentguard.decisions</b> (counter, tags result/reason): automatic and human verdicts</li>
 *   <li><b>agentguard.escalations.created</b> (counter)</li>
 *   <li><b>agentguard.escalations.resolved</b> (counter, tag decision)</li>
 *   <li><b>agentguard.kill_switch.changes</b> (counter, tag state)</li>
 *   <li><b>agentguard.escalations.pending</b> (gauge): size of the review queue, read from
 *       the database on scrape</li>
 * </ul>
 */
@Service
public class DecisionMetricsService {

    private static final Logger log = LoggerFactory.getLogger(DecisionMetricsService.class);

    private final MeterRegistry meterRegistry;
    private final Counter escalationsCreatedCounter;

    public DecisionMetricsService(MeterRegistry meterRegistry, PendingRequestJpaRepository pendingRequestJpaRepository) {
        this.meterRegistry = meterRegistry;

        this.escalationsCreatedCounter = Counter.builder("agentguard.escalations.created")
                .description("Requests escalated for human review")
                .register(meterRegistry);

        Gauge.builder(
                        "agentguard.escalations.pending",
                        pendingRequestJpaRepository,
                        repository -> repository.countByStatus(PendingStatus.PENDING))
                .description("Escalated requests awaiting a human verdict")
                .strongReference(true)
                .register(meterRegistry);

        log.info("Decision metrics registered");
    }

    @EventListener
    public void onDecisionEvent(DecisionEvent event) {
        switch (event.getEventType()) {
            case DECISION_RECORDED -> countDecision(event);
            case ESCALATION_CREATED -> escalationsCreatedCounter.increment();
            case ESCALATION_RESOLVED -> {
                countDecision(event);
                meterRegistry
                        .counter("agentguard.escalations.resolved", "decision", event.getResult().getValue())
                        .increment();
            }
            case KILL_SWITCH_CHANGED -> meterRegistry
                    .counter("agentguard.kill_switch.changes", "state", String.valueOf(event.getDetails().get("state")))
                    .increment();
            case AGENT_STATUS_CHANGED -> log.debug("Agent {} status changed", event.getAgentId());
        }
    }

    private void countDecision(DecisionEvent event) {
        meterRegistry
                .counter(
                        "agentguard.decisions",
                        "result",
                        event.getResult().getValue(),
                        "reason",
                        event.getReason().getValue())
                .increment();
    }
}
