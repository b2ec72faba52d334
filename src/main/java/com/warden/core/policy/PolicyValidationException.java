package com.warden.core.policy;

/**
 * A single rule definition is malformed. Raised during load and aborts the
 * whole load.
 */
public class PolicyValidationException extends PolicyRegistryException {

    public PolicyValidationException(String message, String policyId) {
        super(message, policyId);
    }

    public PolicyValidationException(String message, String policyId, Throwable cause) {
        super(message, policyId, cause);
    }
}
