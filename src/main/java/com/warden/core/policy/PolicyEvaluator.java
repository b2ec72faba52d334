package com.warden.core.policy;

import com.warden.core.model.Action;
import com.warden.core.model.Decision;
import com.warden.core.model.Policy;
import com.warden.core.model.PolicySeverity;

import java.util.Map;
import java.util.Optional;

/**
 * Matches one {@link Action} against one {@link Policy}.
 * <p>
 * Stateless and free of I/O: the same inputs always produce the same
 * decision content. Conditions are conjunctive; an empty condition mapping
 * never matches; an unrecognised condition key never matches. Any failure
 * while matching, a stack overflow in a regex included, is rethrown as
 * {@link PolicyEvaluationException} so the engine can fail closed.
 */
public class PolicyEvaluator {

    /**
     * @return the decision this policy produces for the action, or empty when
     *         the policy's conditions do not all hold
     * @throws PolicyEvaluationException if matching fails
     */
    public Optional<Decision> evaluate(Action action, Policy policy) {
        boolean matched;
        try {
            matched = conditionsHold(action, policy.conditions());
        } catch (RuntimeException | StackOverflowError e) {
            // deeply backtracking target patterns overflow inside java.util.regex
            throw new PolicyEvaluationException(
                    "Failed to evaluate policy " + policy.id() + ": " + e.getMessage(), policy.id(), e);
        }
        if (!matched) {
            return Optional.empty();
        }

        if (policy.severity() == PolicySeverity.DENY) {
            return Optional.of(Decision.deny(
                    action.id(),
                    policy.id(),
                    "Policy " + policy.name() + ": " + policy.description(),
                    ReplanHints.forPolicy(policy.id())));
        }
        return Optional.of(Decision.allow(
                action.id(),
                policy.id(),
                "Policy " + policy.name() + ": conditions met, action allowed"));
    }

    boolean conditionsHold(Action action, Map<String, Object> conditions) {
        if (conditions.isEmpty()) {
            return false;
        }
        for (Map.Entry<String, Object> condition : conditions.entrySet()) {
            Optional<ConditionOperator> operator = ConditionOperator.forKey(condition.getKey());
            if (operator.isEmpty() || !operator.get().test(action, condition.getValue())) {
                return false;
            }
        }
        return true;
    }
}
