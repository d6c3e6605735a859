package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Canonical firewall action taken on a request.
 *
 * Vendor exports spell actions in many ways ("Blocked", "managed_challenge",
 * "jschallenge", ...). Every spelling collapses into one of these values;
 * anything unrecognized becomes {@link #UNKNOWN}.
 */
public enum WafAction {

    BLOCK("block"),
    CHALLENGE("challenge"),
    LOG("log"),
    SKIP("skip"),
    ALLOW("allow"),
    UNKNOWN("unknown");

    private final String value;

    WafAction(String value) {
        this.value = value;
    }

    /**
     * Get the stored string value of the action
     *
     * @return lower-case action name as persisted
     */
    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Normalize a vendor action spelling.
     *
     * The input is lower-cased and stripped of underscores and hyphens before
     * being matched against the known synonyms.
     *
     * @param raw action as found in the export, may be null
     * @return the canonical action, never null
     */
    public static WafAction normalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return UNKNOWN;
        }

        String folded = raw.toLowerCase().replace("_", "").replace("-", "");
        return switch (folded) {
            case "block", "blocked" -> BLOCK;
            case "challenge", "challenged", "jschallenge", "managedchallenge" -> CHALLENGE;
            case "log", "logged" -> LOG;
            case "skip", "skipped", "bypass" -> SKIP;
            case "allow", "allowed", "pass" -> ALLOW;
            default -> UNKNOWN;
        };
    }

    /**
     * Parse a stored value back into the enum.
     *
     * @param value persisted value
     * @return matching action, or UNKNOWN for anything else
     */
    public static WafAction fromValue(String value) {
        for (WafAction action : values()) {
            if (action.value.equalsIgnoreCase(value)) {
                return action;
            }
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return value;
    }
}
