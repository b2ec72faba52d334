package com.warden.config;

import com.warden.core.audit.AuditTrail;
import com.warden.core.audit.DecisionContractCodec;
import com.warden.core.audit.DecisionLogger;
import com.warden.core.health.PolicyRegistryHealthIndicator;
import com.warden.core.metrics.PolicyMetrics;
import com.warden.core.policy.PolicyEngine;
import com.warden.core.policy.PolicyEvaluator;
import com.warden.core.policy.PolicyRegistry;
import com.warden.core.policy.YamlPolicySource;
import com.warden.core.replay.DecisionReplayer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Spring {@link Configuration} that assembles the policy engine.
 * <p>
 * The registry is loaded while the context starts, so a missing, empty or
 * malformed rule set stops the application from starting at all. The
 * in-memory {@link AuditTrail} is optional and can be switched off with
 * {@code warden.policy.audit.enabled=false}.
 */
@Configuration
@EnableConfigurationProperties(PolicyEngineProperties.class)
public class PolicyEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(PolicyEngineConfig.class);

    @Bean
    public PolicyRegistry policyRegistry(PolicyEngineProperties properties) {
        var registry = new PolicyRegistry(new YamlPolicySource(properties.getLocation()));
        registry.load();
        return registry;
    }

    @Bean
    public PolicyEvaluator policyEvaluator() {
        return new PolicyEvaluator();
    }

    @Bean
    @ConditionalOnProperty(prefix = "warden.policy.audit", name = "enabled", havingValue = "true", matchIfMissing = true)
    public AuditTrail auditTrail(PolicyEngineProperties properties) {
        return new AuditTrail(properties.getAudit().getMaxEntries());
    }

    @Bean
    public DecisionContractCodec decisionContractCodec() {
        return new DecisionContractCodec();
    }

    @Bean
    public DecisionLogger decisionLogger(DecisionContractCodec codec,
                                         ObjectProvider<AuditTrail> auditTrail,
                                         PolicyEngineProperties properties) {
        Level level = Level.valueOf(properties.getDecisionLogLevel().toUpperCase(Locale.ROOT));
        return new DecisionLogger(codec, auditTrail.getIfAvailable(), level);
    }

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry policyMeterRegistry() {
        log.info("No MeterRegistry available; policy metrics will be kept in a SimpleMeterRegistry");
        return new SimpleMeterRegistry();
    }

    @Bean
    public PolicyMetrics policyMetrics(MeterRegistry meterRegistry) {
        return new PolicyMetrics(meterRegistry);
    }

    @Bean
    public PolicyEngine policyEngine(PolicyRegistry registry, PolicyEvaluator evaluator,
                                     DecisionLogger decisionLogger, PolicyMetrics metrics) {
        return new PolicyEngine(registry, evaluator, decisionLogger, metrics);
    }

    @Bean
    public DecisionReplayer decisionReplayer(PolicyEngine engine) {
        return new DecisionReplayer(engine);
    }

    @Bean
    public PolicyRegistryHealthIndicator policyRegistryHealthIndicator(PolicyRegistry registry) {
        return new PolicyRegistryHealthIndicator(registry);
    }
}
