package com.warden.core.model;

import java.io.Serializable;
import java.util.Map;
import java.util.Objects;

/**
 * An adjudication rule loaded from the rule source.
 * <p>
 * {@code conditions} maps a condition key (e.g. {@code "action_type"},
 * {@code "target_pattern"}) to its operand and is held as a deep immutable
 * copy. Keys are interpreted only by the evaluator; the policy itself does
 * not judge them.
 *
 * @param id          unique, always starts with {@link #ID_PREFIX}
 * @param name        short human-readable name
 * @param description purpose of the rule, quoted in denial reasons
 * @param severity    ALLOW or DENY when every condition holds
 * @param conditions  conjunctive condition mapping
 */
public record Policy(
    String id,
    String name,
    String description,
    PolicySeverity severity,
    Map<String, Object> conditions
) implements Serializable {

    public static final String ID_PREFIX = "POL_";

    public Policy {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(severity, "severity");
        if (!id.startsWith(ID_PREFIX)) {
            throw new IllegalArgumentException("Policy ID must start with '" + ID_PREFIX + "': " + id);
        }
        conditions = ImmutableValues.copyOf(conditions);
    }
}
