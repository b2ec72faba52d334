package com.warden.core.policy;

/**
 * Thrown when matching one policy against an action fails unexpectedly, for
 * example on a malformed regex or a condition operand of the wrong shape.
 */
public class PolicyEvaluationException extends PolicyException {

    public PolicyEvaluationException(String message, String policyId, Throwable cause) {
        super(message, policyId, cause);
    }
}
