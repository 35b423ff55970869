package com.flagship.bounty_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Counters and timers for the bounty flows.
 *
 * <ul>
 *   <li>{@code bounty.submissions.received} - accepted submissions</li>
 *   <li>{@code bounty.verifications} - verification outcomes, tagged by outcome</li>
 *   <li>{@code bounty.settlements} - settlement outcomes, tagged by status</li>
 *   <li>{@code bounty.collaborator.latency} - external call latency, tagged by collaborator and result</li>
 * </ul>
 */
@Component
public class OrchestrationMetrics {

    private final MeterRegistry registry;

    public OrchestrationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskCreated() {
        registry.counter("bounty.tasks.created").increment();
    }

    public void recordGeneratedDrafts(int created, int skipped) {
        registry.counter("bounty.tasks.generated", "result", "created").increment(created);
        registry.counter("bounty.tasks.generated", "result", "skipped").increment(skipped);
    }

    public void recordSubmissionReceived(String proofType) {
        registry.counter("bounty.submissions.received", "proof_type", sanitizeTag(proofType)).increment();
    }

    public void recordVerification(String outcome) {
        registry.counter("bounty.verifications", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordSettlement(String status) {
        registry.counter("bounty.settlements", "status", sanitizeTag(status)).increment();
    }

    public void recordCollaboratorCall(String collaborator, boolean success, Duration duration) {
        Timer.builder("bounty.collaborator.latency")
                .tag("collaborator", sanitizeTag(collaborator))
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .record(duration);
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
