package com.warden.core.policy;

/**
 * Base type for every policy failure. Each subtype resolves toward denial:
 * nothing in this hierarchy can be caught and turned into an ALLOW.
 */
public class PolicyException extends RuntimeException {

    private final String policyId;

    public PolicyException(String message, String policyId) {
        super(message);
        this.policyId = policyId;
    }

    public PolicyException(String message, String policyId, Throwable cause) {
        super(message, cause);
        this.policyId = policyId;
    }

    /** Id of the policy involved, or {@code null} when the failure is not tied to one. */
    public String getPolicyId() {
        return policyId;
    }
}
