package com.warden.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Warden-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setAction(String actionId, String actionType) {
        put("actionId", actionId);
        put("actionType", actionType);
    }

    public static void setDecision(String decisionId, String policyId) {
        put("decisionId", decisionId);
        put("policyId", policyId);
    }

    public static void clear() {
        MDC.remove("actionId");
        MDC.remove("actionType");
        MDC.remove("decisionId");
        MDC.remove("policyId");
    }

    private static void put(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }
}
