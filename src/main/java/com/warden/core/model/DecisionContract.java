package com.warden.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.Map;

/**
 * The externally consumable form of a {@link Decision}: everything a human or
 * another process needs to act on the decision and nothing else. Every field
 * is a plain string, map or null so the contract serializes losslessly.
 *
 * @param result    "ALLOW" or "DENY"
 * @param severity  "soft" or "hard"
 * @param timestamp ISO-8601 instant
 */
@JsonPropertyOrder({"decision_id", "action_id", "policy_id", "result", "reason",
        "suggestion", "alternative", "severity", "timestamp"})
public record DecisionContract(
    @JsonProperty("decision_id") String decisionId,
    @JsonProperty("action_id") String actionId,
    @JsonProperty("policy_id") String policyId,
    @JsonProperty("result") String result,
    @JsonProperty("reason") String reason,
    @JsonProperty("suggestion") String suggestion,
    @JsonProperty("alternative") Map<String, Object> alternative,
    @JsonProperty("severity") String severity,
    @JsonProperty("timestamp") String timestamp
) implements Serializable {}
