package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Rule rollup row
 */
public class TopRule {

    @JsonProperty("rule_id")
    private final String ruleId;

    @JsonProperty("rule_name")
    private final String ruleName;

    @JsonProperty("rule_type")
    private final RuleType ruleType;

    @JsonProperty("count")
    private final long count;

    @JsonProperty("last_seen")
    private final Long lastSeen;

    public TopRule(String ruleId, String ruleName, RuleType ruleType, long count, Long lastSeen) {
        this.ruleId = ruleId;
        this.ruleName = ruleName;
        this.ruleType = ruleType;
        this.count = count;
        this.lastSeen = lastSeen;
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getRuleName() {
        return ruleName;
    }

    public RuleType getRuleType() {
        return ruleType;
    }

    public long getCount() {
        return count;
    }

    public Long getLastSeen() {
        return lastSeen;
    }
}
