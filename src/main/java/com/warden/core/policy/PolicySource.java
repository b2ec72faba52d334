package com.warden.core.policy;

import java.util.List;

/**
 * Supplies raw rule definitions to a {@link PolicyRegistry}. Called once per
 * registry; the order of the returned list is the evaluation order.
 */
@FunctionalInterface
public interface PolicySource {

    /**
     * @throws PolicyRegistryException if the source is missing or cannot be read
     */
    List<PolicyDefinition> readDefinitions();

    /** Human-readable description of where definitions come from. */
    default String describe() {
        return getClass().getSimpleName();
    }
}
