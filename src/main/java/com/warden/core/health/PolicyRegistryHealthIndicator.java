package com.warden.core.health;

import com.warden.core.model.Policy;
import com.warden.core.policy.PolicyRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.List;

/**
 * Actuator health indicator for the policy registry.
 * Reports the loaded rule set; a registry that is not loaded is DOWN.
 */
public class PolicyRegistryHealthIndicator implements HealthIndicator {

    private final PolicyRegistry registry;

    public PolicyRegistryHealthIndicator(PolicyRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        if (!registry.isLoaded()) {
            return Health.down()
                    .withDetail("source", registry.describeSource())
                    .withDetail("reason", "policy registry not loaded")
                    .build();
        }
        List<String> ids = registry.getAll().stream().map(Policy::id).toList();
        return Health.up()
                .withDetail("source", registry.describeSource())
                .withDetail("policies", ids.size())
                .withDetail("ids", ids)
                .build();
    }
}
