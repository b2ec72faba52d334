package com.warden.core.model;

import java.util.Optional;

/**
 * What a policy does to an action once all of its conditions hold.
 */
public enum PolicySeverity {
    ALLOW("allow"),
    DENY("deny");

    private final String wireName;

    PolicySeverity(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Parses the rule-file form ({@code "allow"} or {@code "deny"}); anything else is empty. */
    public static Optional<PolicySeverity> fromWireName(String value) {
        for (PolicySeverity severity : values()) {
            if (severity.wireName.equals(value)) {
                return Optional.of(severity);
            }
        }
        return Optional.empty();
    }
}
