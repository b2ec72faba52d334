package com.warden.core.policy;

import com.warden.core.model.Action;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The closed set of condition predicates a policy may use.
 * <p>
 * Each operator is keyed by its rule-file name and reads the action only
 * through {@link Action#metadata()}'s typed accessors. Condition text is never
 * executed as an expression. Operands of the wrong shape raise
 * {@link IllegalArgumentException}; the evaluator turns that into a
 * {@link PolicyEvaluationException}.
 */
public enum ConditionOperator {

    ACTION_TYPE("action_type") {
        @Override
        boolean test(Action action, Object operand) {
            return action.type().equals(requireString(operand));
        }
    },

    ACTION_TYPE_PREFIX("action_type_prefix") {
        @Override
        boolean test(Action action, Object operand) {
            return action.type().startsWith(requireString(operand));
        }
    },

    TARGET_EQUALS("target_equals") {
        @Override
        boolean test(Action action, Object operand) {
            return action.target().equals(requireString(operand));
        }
    },

    TARGET_CONTAINS("target_contains") {
        @Override
        boolean test(Action action, Object operand) {
            return action.target().contains(requireString(operand));
        }
    },

    /** Regex searched anywhere in the target, not anchored. */
    TARGET_PATTERN("target_pattern") {
        @Override
        boolean test(Action action, Object operand) {
            return Pattern.compile(requireString(operand)).matcher(action.target()).find();
        }
    },

    METADATA_KEY("metadata_key") {
        @Override
        boolean test(Action action, Object operand) {
            return action.metadata().containsKey(requireString(operand));
        }
    },

    /** {@code {key, value}}: metadata value equals the operand value. */
    METADATA_VALUE("metadata_value") {
        @Override
        boolean test(Action action, Object operand) {
            Map<?, ?> spec = requireMapping(operand);
            return action.metadata().valueEquals(requireKey(spec), spec.get("value"));
        }
    },

    /** {@code {key, threshold}}: a missing key reads as 0. */
    METADATA_GT("metadata_gt") {
        @Override
        boolean test(Action action, Object operand) {
            Map<?, ?> spec = requireMapping(operand);
            Object threshold = spec.get("threshold");
            if (!(threshold instanceof Number limit)) {
                throw new IllegalArgumentException("metadata_gt requires a numeric 'threshold', got: " + threshold);
            }
            return action.metadata().compareNumber(requireKey(spec), limit) > 0;
        }
    },

    /** {@code {key, allowed}}: a missing key is not in any list. */
    METADATA_IN_LIST("metadata_in_list") {
        @Override
        boolean test(Action action, Object operand) {
            Map<?, ?> spec = requireMapping(operand);
            return action.metadata().valueIn(requireKey(spec), allowedValues(spec));
        }
    },

    /** {@code {key, allowed}}: a missing key counts as outside the list. */
    METADATA_NOT_IN_LIST("metadata_not_in_list") {
        @Override
        boolean test(Action action, Object operand) {
            Map<?, ?> spec = requireMapping(operand);
            return !action.metadata().valueIn(requireKey(spec), allowedValues(spec));
        }
    },

    /** Matches only on a literal {@code true}. */
    ALWAYS("always") {
        @Override
        boolean test(Action action, Object operand) {
            return Boolean.TRUE.equals(operand);
        }
    };

    private final String key;

    ConditionOperator(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    abstract boolean test(Action action, Object operand);

    public static Optional<ConditionOperator> forKey(String key) {
        for (ConditionOperator operator : values()) {
            if (operator.key.equals(key)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }

    String requireString(Object operand) {
        if (operand instanceof String s) {
            return s;
        }
        throw new IllegalArgumentException(key + " requires a string operand, got: " + operand);
    }

    Map<?, ?> requireMapping(Object operand) {
        if (operand instanceof Map<?, ?> map) {
            return map;
        }
        throw new IllegalArgumentException(key + " requires a mapping operand, got: " + operand);
    }

    String requireKey(Map<?, ?> spec) {
        Object metadataKey = spec.get("key");
        if (metadataKey instanceof String s && !s.isEmpty()) {
            return s;
        }
        throw new IllegalArgumentException(key + " requires a non-empty 'key', got: " + metadataKey);
    }

    Collection<?> allowedValues(Map<?, ?> spec) {
        Object allowed = spec.get("allowed");
        if (allowed == null) {
            return List.of();
        }
        if (allowed instanceof Collection<?> values) {
            return values;
        }
        throw new IllegalArgumentException(key + " requires 'allowed' to be a list, got: " + allowed);
    }
}
