package com.warden.core.model;

/**
 * Outcome of adjudicating one action.
 */
public enum DecisionResult {
    ALLOW,
    DENY
}
