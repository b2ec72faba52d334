package com.warden.core.policy;

import java.util.Map;

/**
 * One raw rule definition as read from the rule source, before validation.
 *
 * @param origin where the definition came from (file name), used in error messages
 * @param data   parsed document; null when the document was empty or not a mapping
 */
public record PolicyDefinition(
    String origin,
    Map<String, Object> data
) {}
