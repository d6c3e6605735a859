package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of the rule that matched a request.
 */
public enum RuleType {

    /**
     * Rule from a vendor-managed ruleset (OWASP core ruleset, vendor managed rules).
     */
    MANAGED("managed"),

    /**
     * Rule written by the zone owner.
     */
    CUSTOM("custom"),

    UNKNOWN("unknown");

    private final String value;

    RuleType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Infer the rule type from the rule id and the detection source label.
     *
     * Best-effort only: exports do not state the ruleset explicitly, so the
     * classification relies on id prefixes and well-known substrings.
     *
     * @param ruleId matched rule id, may be null
     * @param service detection service/source label, may be null
     * @return inferred rule type, never null
     */
    public static RuleType infer(String ruleId, String service) {
        if (ruleId == null || ruleId.isEmpty()) {
            return UNKNOWN;
        }

        if (ruleId.startsWith("managed_") || ruleId.contains("OWASP")
                || ruleId.contains("cloudflare") || "managed".equals(service)) {
            return MANAGED;
        }

        if (ruleId.startsWith("custom_") || "custom".equals(service)) {
            return CUSTOM;
        }

        return UNKNOWN;
    }

    public static RuleType fromValue(String value) {
        for (RuleType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return value;
    }
}
