package com.warden.core.model;

import java.io.Serializable;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * An operation an agent proposes to perform, submitted for adjudication before
 * it is executed.
 *
 * @param id       unique per attempt
 * @param type     dotted category, e.g. "file.write", "git.push", "tool.execute"
 * @param target   resource the action touches, e.g. "refs/heads/main" or a file path
 * @param metadata additional context read by metadata conditions
 */
public record Action(
    String id,
    String type,
    String target,
    ActionMetadata metadata
) implements Serializable {

    public Action {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(target, "target");
        metadata = metadata == null ? ActionMetadata.empty() : metadata;
    }

    public static Action create(String type, String target, Map<String, ?> metadata) {
        return new Action(UUID.randomUUID().toString(), type, target, ActionMetadata.of(metadata));
    }

    public static Action create(String type, String target) {
        return create(type, target, Map.of());
    }
}
