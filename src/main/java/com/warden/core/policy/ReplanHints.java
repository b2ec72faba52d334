package com.warden.core.policy;

import com.warden.core.model.ReplanHint;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed policy-id to replan-hint table. A denying policy missing from the
 * table yields {@link ReplanHint#NONE}; that is a gap in the table, not an
 * error.
 */
public final class ReplanHints {

    private static final Map<String, ReplanHint> HINTS = Map.of(
            "POL_001_branch_scope", ReplanHint.of(
                    "Create a feature/* branch and open a PR",
                    ordered("target_pattern", "refs/heads/feature/*")),
            "POL_002_file_class", ReplanHint.of(
                    "Move change to non-governance path",
                    ordered("excluded_paths", List.of(".github/workflows/"))),
            "POL_003_policy_immutability", ReplanHint.of(
                    "Policy layer is immutable; modify via governance process"),
            "POL_004_tool_allowlist", ReplanHint.of(
                    "Use an allowed tool or request approval",
                    ordered("allowed_tools", List.of("read", "write", "edit", "glob", "grep", "bash",
                            "web_fetch", "web_search", "todo_write", "ask_user"))),
            "POL_005_rate_guard", ReplanHint.of(
                    "Retry after rate window resets",
                    ordered("rate_limit", 60, "window", "1 minute")),
            PolicyIds.FAIL_CLOSE, ReplanHint.of(
                    "Action denied due to system safety fallback")
    );

    private ReplanHints() {}

    /** Alternatives keep their declared key order so the logged JSON is stable across runs. */
    private static Map<String, Object> ordered(Object... keysAndValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return map;
    }

    public static ReplanHint forPolicy(String policyId) {
        return HINTS.getOrDefault(policyId, ReplanHint.NONE);
    }

    public static boolean hasHint(String policyId) {
        return HINTS.containsKey(policyId);
    }
}
