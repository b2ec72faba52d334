package com.warden.core.policy;

import com.warden.core.model.Decision;

/**
 * Thrown by {@link PolicyEngine#enforce} when an action is denied. This is an
 * expected outcome rather than a fault; the attached {@link Decision} carries
 * the reason and replan hint.
 */
public class PolicyDeniedException extends PolicyException {

    private final Decision decision;

    public PolicyDeniedException(Decision decision) {
        super(decision.reason(), decision.policyId());
        this.decision = decision;
    }

    public Decision getDecision() {
        return decision;
    }

    public String getActionId() {
        return decision.actionId();
    }

    @Override
    public String toString() {
        return "PolicyDenied[" + getPolicyId() + "]: " + getMessage() + " (action=" + getActionId() + ")";
    }
}
