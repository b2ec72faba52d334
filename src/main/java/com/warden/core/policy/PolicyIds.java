package com.warden.core.policy;

import java.util.Set;

/**
 * Policy ids the engine itself emits. Rule files may not use them.
 */
public final class PolicyIds {

    /** Attached to every denial produced because evaluation failed. */
    public static final String FAIL_CLOSE = "POL_006_fail_close";

    /** Attached to the ALLOW returned when no policy matched. */
    public static final String DEFAULT_ALLOW = "POL_000_default_allow";

    public static final Set<String> RESERVED = Set.of(FAIL_CLOSE, DEFAULT_ALLOW);

    private PolicyIds() {}

    public static boolean isReserved(String policyId) {
        return RESERVED.contains(policyId);
    }
}
