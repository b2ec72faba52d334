package com.warden.core.policy;

import com.warden.core.audit.DecisionLogger;
import com.warden.core.logging.MdcContext;
import com.warden.core.metrics.PolicyMetrics;
import com.warden.core.model.Action;
import com.warden.core.model.Decision;
import com.warden.core.model.Policy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Adjudicates every action an agent proposes against the loaded rule set.
 * <p>
 * Policies are checked in registry order. The first matching DENY wins
 * immediately; otherwise the first matching ALLOW wins; otherwise the action
 * is allowed by default. Any failure during adjudication, a stack overflow
 * included, stops evaluation and yields a DENY tagged {@link PolicyIds#FAIL_CLOSE}. {@link #evaluate} never
 * throws and never returns null, and it never blocks: the rule set is already
 * in memory and matching does no I/O.
 * <p>
 * Every decision is handed to the {@link DecisionLogger} before it is
 * returned. A logging failure is reported at ERROR and counted, and the
 * decision is still returned.
 */
public class PolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);

    static final String DEFAULT_ALLOW_REASON = "No policy matched; action allowed by default";

    private final PolicyRegistry registry;
    private final PolicyEvaluator evaluator;
    private final DecisionLogger decisionLogger;
    private final PolicyMetrics metrics;

    /**
     * Loads the registry eagerly: an engine cannot exist without a complete rule set.
     *
     * @throws PolicyRegistryException if the registry cannot be loaded
     */
    public PolicyEngine(PolicyRegistry registry, PolicyEvaluator evaluator,
                        DecisionLogger decisionLogger, PolicyMetrics metrics) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.decisionLogger = Objects.requireNonNull(decisionLogger, "decisionLogger");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        List<Policy> policies = registry.load();
        metrics.recordRegistrySize(policies.size());
        log.info("Policy engine ready with {} policies", policies.size());
    }

    /**
     * Returns exactly one decision for the action.
     */
    public Decision evaluate(Action action) {
        long start = System.nanoTime();
        Decision decision;
        try {
            if (action != null) {
                MdcContext.setAction(action.id(), action.type());
            }
            try {
                decision = adjudicate(action);
            } catch (RuntimeException | StackOverflowError e) {
                decision = failClose(action, e);
            }
            MdcContext.setDecision(decision.decisionId(), decision.policyId());
            record(decision, action, System.nanoTime() - start);
        } finally {
            MdcContext.clear();
        }
        return decision;
    }

    /**
     * Evaluates the action and throws if it is denied.
     *
     * @return the ALLOW decision
     * @throws PolicyDeniedException carrying the DENY decision
     */
    public Decision enforce(Action action) {
        Decision decision = evaluate(action);
        if (decision.isDenied()) {
            throw new PolicyDeniedException(decision);
        }
        return decision;
    }

    public PolicyRegistry getRegistry() {
        return registry;
    }

    private Decision adjudicate(Action action) {
        Objects.requireNonNull(action, "action");
        Decision firstAllow = null;
        for (Policy policy : registry.load()) {
            Optional<Decision> match = evaluator.evaluate(action, policy);
            if (match.isEmpty()) {
                continue;
            }
            Decision decision = match.get();
            if (decision.isDenied()) {
                log.debug("Action {} denied by {}", action.id(), policy.id());
                return decision;
            }
            if (firstAllow == null) {
                firstAllow = decision;
            }
        }
        if (firstAllow != null) {
            return firstAllow;
        }
        return Decision.allow(action.id(), PolicyIds.DEFAULT_ALLOW, DEFAULT_ALLOW_REASON);
    }

    private Decision failClose(Action action, Throwable cause) {
        var failure = new FailCloseException(describe(cause), cause);
        String actionId = action != null ? action.id() : null;
        log.warn("Fail-close triggered for action {}: {}", actionId, failure.getMessage(), failure);
        recordMetrics(() -> metrics.incrementFailClose(cause.getClass().getSimpleName()));
        return Decision.deny(actionId, PolicyIds.FAIL_CLOSE,
                "Fail-close: " + failure.getMessage(), ReplanHints.forPolicy(PolicyIds.FAIL_CLOSE));
    }

    private void record(Decision decision, Action action, long elapsedNanos) {
        recordMetrics(() -> {
            metrics.recordDecision(decision.result().name(), decision.policyId());
            metrics.recordEvaluationDuration(decision.result().name(), elapsedNanos);
        });
        try {
            decisionLogger.log(decision, action);
        } catch (RuntimeException e) {
            recordMetrics(metrics::incrementAuditFailures);
            log.error("Failed to write decision {} ({} by {}) to the decision log: {}",
                    decision.decisionId(), decision.result(), decision.policyId(), e.getMessage(), e);
        }
    }

    private void recordMetrics(Runnable update) {
        try {
            update.run();
        } catch (RuntimeException e) {
            log.warn("Failed to update policy metrics: {}", e.getMessage(), e);
        }
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            return cause.getClass().getSimpleName();
        }
        return message;
    }
}
