package com.warden.core.model;

/**
 * How binding a decision is for the caller. A {@code HARD} decision means the
 * action must be replanned; {@code SOFT} means the caller may proceed.
 */
public enum DecisionSeverity {
    SOFT("soft"),
    HARD("hard");

    private final String wireName;

    DecisionSeverity(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static DecisionSeverity forResult(DecisionResult result) {
        return result == DecisionResult.DENY ? HARD : SOFT;
    }

    public static DecisionSeverity fromWireName(String value) {
        for (DecisionSeverity severity : values()) {
            if (severity.wireName.equals(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown decision severity: " + value);
    }
}
