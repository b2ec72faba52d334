package com.warden.core.audit;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.warden.core.model.Action;
import com.warden.core.model.Decision;
import com.warden.core.model.DecisionContract;

import java.io.Serializable;
import java.util.Map;

/**
 * One structured audit record: the decision contract fields plus the
 * identifying fields of the action that was adjudicated. This is the form
 * written to the decision log and kept by {@link AuditTrail}.
 */
@JsonPropertyOrder({"log_type", "decision_id", "action_id", "action_type", "action_target",
        "action_metadata", "policy_id", "result", "reason", "suggestion", "alternative",
        "severity", "timestamp"})
public record AuditEntry(
    @JsonProperty("log_type") String logType,
    @JsonProperty("decision_id") String decisionId,
    @JsonProperty("action_id") String actionId,
    @JsonProperty("action_type") String actionType,
    @JsonProperty("action_target") String actionTarget,
    @JsonProperty("action_metadata") Map<String, Object> actionMetadata,
    @JsonProperty("policy_id") String policyId,
    @JsonProperty("result") String result,
    @JsonProperty("reason") String reason,
    @JsonProperty("suggestion") String suggestion,
    @JsonProperty("alternative") Map<String, Object> alternative,
    @JsonProperty("severity") String severity,
    @JsonProperty("timestamp") String timestamp
) implements Serializable {

    public static final String LOG_TYPE = "policy_decision";

    /**
     * @param action the adjudicated action; may be null when the engine failed closed on a missing action
     */
    public static AuditEntry of(Decision decision, Action action) {
        DecisionContract contract = decision.toContract();
        return new AuditEntry(
                LOG_TYPE,
                contract.decisionId(),
                action != null ? action.id() : contract.actionId(),
                action != null ? action.type() : null,
                action != null ? action.target() : null,
                action != null ? action.metadata().asMap() : Map.of(),
                contract.policyId(),
                contract.result(),
                contract.reason(),
                contract.suggestion(),
                contract.alternative(),
                contract.severity(),
                contract.timestamp()
        );
    }

    public boolean denied() {
        return "DENY".equals(result);
    }

    public DecisionContract toContract() {
        return new DecisionContract(decisionId, actionId, policyId, result, reason,
                suggestion, alternative, severity, timestamp);
    }
}
