package com.warden.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for the policy engine.
 *
 * <pre>
 * warden:
 *   policy:
 *     location: classpath:policies/POL_*.yaml
 *     decision-log-level: INFO
 *     audit:
 *       enabled: true
 *       max-entries: 1000
 * </pre>
 */
@ConfigurationProperties(prefix = "warden.policy")
public class PolicyEngineProperties {

    private String location = "classpath:policies/POL_*.yaml";
    private String decisionLogLevel = "INFO";
    private Audit audit = new Audit();

    public String getLocation() { return location; }
    public void setLocation(String location) { this.location = location; }
    public String getDecisionLogLevel() { return decisionLogLevel; }
    public void setDecisionLogLevel(String decisionLogLevel) { this.decisionLogLevel = decisionLogLevel; }
    public Audit getAudit() { return audit; }
    public void setAudit(Audit audit) { this.audit = audit; }

    public static class Audit {
        private boolean enabled = true;
        private int maxEntries = 1000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getMaxEntries() { return maxEntries; }
        public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }
    }
}
