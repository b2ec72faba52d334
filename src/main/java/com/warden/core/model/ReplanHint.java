package com.warden.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * Guidance attached to a denial describing how to reshape the action so that
 * it complies.
 *
 * @param suggestion  natural-language hint, null when none is known
 * @param alternative structured hint (e.g. an alternative target pattern), nullable
 */
public record ReplanHint(
    String suggestion,
    Map<String, Object> alternative
) implements Serializable {

    public static final ReplanHint NONE = new ReplanHint(null, null);

    public ReplanHint {
        alternative = alternative == null ? null : ImmutableValues.copyOf(alternative);
    }

    public static ReplanHint of(String suggestion) {
        return new ReplanHint(suggestion, null);
    }

    public static ReplanHint of(String suggestion, Map<String, Object> alternative) {
        return new ReplanHint(suggestion, alternative);
    }
}
