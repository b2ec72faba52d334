package com.warden.core.policy;

import com.warden.core.model.Policy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Holds the complete, validated rule set.
 * <p>
 * {@link #load()} reads every definition from the {@link PolicySource} and
 * publishes them in a single step: either all definitions validate and the
 * whole set becomes visible, or the load throws and nothing does. Once loaded
 * the registry is frozen and further {@code load()} calls return the cached
 * set. Reads after load take no locks.
 */
public class PolicyRegistry implements Iterable<Policy> {

    private static final Logger log = LoggerFactory.getLogger(PolicyRegistry.class);

    private final PolicySource source;
    private final PolicyDefinitionParser parser;

    /** Null until the first successful load. */
    private volatile Snapshot snapshot;

    public PolicyRegistry(PolicySource source) {
        this(source, new PolicyDefinitionParser());
    }

    public PolicyRegistry(PolicySource source, PolicyDefinitionParser parser) {
        this.source = source;
        this.parser = parser;
    }

    /**
     * Loads the rule set on first call; later calls return the same set.
     *
     * @return the policies in evaluation order (unmodifiable)
     * @throws PolicyRegistryException   if the source is missing, empty or unreadable
     * @throws PolicyValidationException if any definition is malformed or an id repeats
     */
    public List<Policy> load() {
        Snapshot current = snapshot;
        if (current != null) {
            return current.policies();
        }
        synchronized (this) {
            if (snapshot == null) {
                snapshot = buildSnapshot();
            }
            return snapshot.policies();
        }
    }

    public boolean isLoaded() {
        return snapshot != null;
    }

    /** Copy of every policy in evaluation order; loads on first use. */
    public List<Policy> getAll() {
        return new ArrayList<>(loaded().policies());
    }

    public Optional<Policy> getById(String policyId) {
        return Optional.ofNullable(loaded().byId().get(policyId));
    }

    public int size() {
        return loaded().policies().size();
    }

    @Override
    public Iterator<Policy> iterator() {
        return loaded().policies().iterator();
    }

    public String describeSource() {
        return source.describe();
    }

    private Snapshot loaded() {
        Snapshot current = snapshot;
        if (current == null) {
            load();
            current = snapshot;
        }
        return current;
    }

    private Snapshot buildSnapshot() {
        List<PolicyDefinition> definitions;
        try {
            definitions = source.readDefinitions();
        } catch (PolicyRegistryException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PolicyRegistryException(
                    "Failed to read policy source " + source.describe() + ": " + e.getMessage(), e);
        }
        if (definitions == null || definitions.isEmpty()) {
            throw new PolicyRegistryException("Policy source yielded no definitions: " + source.describe());
        }

        Map<String, Policy> byId = new LinkedHashMap<>();
        for (PolicyDefinition definition : definitions) {
            Policy policy;
            try {
                policy = parser.parse(definition);
            } catch (IllegalArgumentException e) {
                throw new PolicyValidationException(
                        "Invalid policy in " + definition.origin() + ": " + e.getMessage(), definition.origin(), e);
            }
            if (byId.putIfAbsent(policy.id(), policy) != null) {
                throw new PolicyValidationException("Duplicate policy ID: " + policy.id(), policy.id());
            }
        }

        List<Policy> ordered = List.copyOf(byId.values());
        log.info("Loaded {} policies from {}: {}", ordered.size(), source.describe(), byId.keySet());
        return new Snapshot(ordered, Collections.unmodifiableMap(byId));
    }

    private record Snapshot(List<Policy> policies, Map<String, Policy> byId) {}
}
