package com.warden.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Result of adjudicating one {@link Action}. Created exactly once per
 * evaluation and never mutated.
 *
 * @param decisionId  fresh per evaluation
 * @param actionId    id of the evaluated action (nullable only for fail-close on a missing action)
 * @param policyId    policy that produced the decision, or a reserved sentinel id
 * @param result      ALLOW or DENY
 * @param reason      human-readable explanation, never blank
 * @param severity    HARD for DENY, SOFT for ALLOW
 * @param suggestion  replan hint for denials, nullable
 * @param alternative structured replan hint, nullable
 * @param timestamp   when the decision was made
 */
public record Decision(
    String decisionId,
    String actionId,
    String policyId,
    DecisionResult result,
    String reason,
    DecisionSeverity severity,
    String suggestion,
    Map<String, Object> alternative,
    Instant timestamp
) implements Serializable {

    public Decision {
        Objects.requireNonNull(decisionId, "decisionId");
        Objects.requireNonNull(policyId, "policyId");
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(timestamp, "timestamp");
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Decision reason must not be blank");
        }
        if (severity == null) {
            severity = DecisionSeverity.forResult(result);
        }
        alternative = alternative == null ? null : ImmutableValues.copyOf(alternative);
    }

    public static Decision allow(String actionId, String policyId, String reason) {
        return new Decision(UUID.randomUUID().toString(), actionId, policyId, DecisionResult.ALLOW,
                reason, DecisionSeverity.SOFT, null, null, Instant.now());
    }

    public static Decision deny(String actionId, String policyId, String reason, ReplanHint hint) {
        ReplanHint h = hint == null ? ReplanHint.NONE : hint;
        return new Decision(UUID.randomUUID().toString(), actionId, policyId, DecisionResult.DENY,
                reason, DecisionSeverity.HARD, h.suggestion(), h.alternative(), Instant.now());
    }

    public boolean isDenied() {
        return result == DecisionResult.DENY;
    }

    public DecisionContract toContract() {
        return new DecisionContract(
                decisionId,
                actionId,
                policyId,
                result.name(),
                reason,
                suggestion,
                alternative,
                severity.wireName(),
                timestamp.toString()
        );
    }
}
