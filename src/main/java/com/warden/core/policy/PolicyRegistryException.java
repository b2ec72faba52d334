package com.warden.core.policy;

/**
 * Fatal failure while loading the rule set. A registry that raised this holds
 * no policies and an engine cannot be built on top of it.
 */
public class PolicyRegistryException extends PolicyException {

    public PolicyRegistryException(String message) {
        super(message, null);
    }

    public PolicyRegistryException(String message, Throwable cause) {
        super(message, null, cause);
    }

    protected PolicyRegistryException(String message, String policyId) {
        super(message, policyId);
    }

    protected PolicyRegistryException(String message, String policyId, Throwable cause) {
        super(message, policyId, cause);
    }
}
