package com.warden.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for policy adjudication.
 */
public class PolicyMetrics {

    private final MeterRegistry registry;

    public PolicyMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDecision(String result, String policyId) {
        Counter.builder("warden.policy.decisions")
                .description("Decisions returned by the policy engine")
                .tag("result", result)
                .tag("policy", policyId)
                .register(registry)
                .increment();
    }

    public void recordEvaluationDuration(String result, long nanos) {
        Timer.builder("warden.policy.evaluation.duration")
                .tag("result", result)
                .register(registry)
                .record(Duration.ofNanos(nanos));
    }

    /**
     * Incremented each time adjudication failed and the engine returned a fail-close denial.
     *
     * @param cause simple class name of the failure
     */
    public void incrementFailClose(String cause) {
        Counter.builder("warden.policy.fail_close")
                .description("Evaluations converted to fail-close denials")
                .tag("cause", cause)
                .register(registry)
                .increment();
    }

    public void incrementAuditFailures() {
        Counter.builder("warden.policy.audit.failures")
                .description("Decisions that could not be written to the decision log")
                .register(registry)
                .increment();
    }

    public void recordRegistrySize(int policyCount) {
        DistributionSummary.builder("warden.policy.registry.size")
                .description("Number of policies in the loaded rule set")
                .register(registry)
                .record(policyCount);
    }
}
