package com.warden.core.policy;

import com.warden.core.model.Policy;
import com.warden.core.model.PolicySeverity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates a raw {@link PolicyDefinition} and turns it into a {@link Policy}.
 * Every rejection is a {@link PolicyValidationException} naming the policy
 * (or the file, when the id itself is unusable).
 */
public class PolicyDefinitionParser {

    static final List<String> REQUIRED_FIELDS = List.of("id", "name", "description", "severity", "conditions");

    public Policy parse(PolicyDefinition definition) {
        Map<String, Object> data = definition.data();
        if (data == null) {
            throw new PolicyValidationException("Policy must be a mapping: " + definition.origin(), definition.origin());
        }

        List<String> missing = new ArrayList<>();
        for (String field : REQUIRED_FIELDS) {
            if (data.get(field) == null) {
                missing.add(field);
            }
        }
        String reference = data.get("id") instanceof String s ? s : definition.origin();
        if (!missing.isEmpty()) {
            throw new PolicyValidationException(
                    "Missing required fields " + missing + " in " + definition.origin(), reference);
        }

        String id = requireText(data, "id", reference);
        if (!id.startsWith(Policy.ID_PREFIX)) {
            throw new PolicyValidationException(
                    "Policy ID must start with '" + Policy.ID_PREFIX + "': " + id, id);
        }
        if (PolicyIds.isReserved(id)) {
            throw new PolicyValidationException("Policy ID is reserved by the engine: " + id, id);
        }

        String name = requireText(data, "name", id);
        String description = requireText(data, "description", id);

        Object rawSeverity = data.get("severity");
        PolicySeverity severity = PolicySeverity
                .fromWireName(String.valueOf(rawSeverity))
                .orElseThrow(() -> new PolicyValidationException(
                        "Invalid severity: " + rawSeverity + ". Must be 'allow' or 'deny'", id));

        if (!(data.get("conditions") instanceof Map<?, ?> rawConditions)) {
            throw new PolicyValidationException("Conditions must be a mapping in policy " + id, id);
        }
        Map<String, Object> conditions = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : rawConditions.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new PolicyValidationException(
                        "Condition keys must be strings in policy " + id + ": " + entry.getKey(), id);
            }
            conditions.put(key, entry.getValue());
        }

        return new Policy(id, name, description, severity, conditions);
    }

    private static String requireText(Map<String, Object> data, String field, String reference) {
        if (data.get(field) instanceof String value && !value.isBlank()) {
            return value;
        }
        throw new PolicyValidationException(
                "Field '" + field + "' must be a non-blank string, got: " + data.get(field), reference);
    }
}
