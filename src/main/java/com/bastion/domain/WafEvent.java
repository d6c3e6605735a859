package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Canonical, vendor-agnostic representation of one WAF log record.
 *
 * Instances are immutable. Only {@code rayId} and {@code eventTs} are mandatory;
 * every other attribute is absent (null) when the export did not carry a usable
 * value. The pair (rayId, eventTs) is the natural dedup key of the event table.
 *
 * {@code fileId} and {@code ingestedAt} are only populated on events read back
 * from storage; they are assigned by the writer at insert time.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class WafEvent {

    @JsonProperty("ray_id")
    private final String rayId;

    /**
     * Event time in epoch milliseconds
     */
    @JsonProperty("event_ts")
    private final long eventTs;

    @JsonProperty("src_ip")
    private final String srcIp;

    @JsonProperty("src_country")
    private final String srcCountry;

    @JsonProperty("src_asn")
    private final Long srcAsn;

    /**
     * Edge location (datacenter) code
     */
    @JsonProperty("colo")
    private final String colo;

    @JsonProperty("host")
    private final String host;

    @JsonProperty("path")
    private final String path;

    @JsonProperty("method")
    private final String method;

    @JsonProperty("status")
    private final Integer status;

    @JsonProperty("rule_id")
    private final String ruleId;

    @JsonProperty("rule_name")
    private final String ruleName;

    @JsonProperty("rule_type")
    private final RuleType ruleType;

    @JsonProperty("action")
    private final WafAction action;

    @JsonProperty("service")
    private final String service;

    @JsonProperty("mitigation_reason")
    private final String mitigationReason;

    @JsonProperty("ua")
    private final String userAgent;

    /**
     * TLS client fingerprint (JA3 hash)
     */
    @JsonProperty("ja3")
    private final String ja3;

    @JsonProperty("bytes")
    private final Long bytes;

    @JsonProperty("threat_score")
    private final Long threatScore;

    @JsonProperty("file_id")
    private final Long fileId;

    @JsonProperty("ingested_at")
    private final Long ingestedAt;

    private WafEvent(Builder builder) {
        this.rayId = builder.rayId;
        this.eventTs = builder.eventTs;
        this.srcIp = builder.srcIp;
        this.srcCountry = builder.srcCountry;
        this.srcAsn = builder.srcAsn;
        this.colo = builder.colo;
        this.host = builder.host;
        this.path = builder.path;
        this.method = builder.method;
        this.status = builder.status;
        this.ruleId = builder.ruleId;
        this.ruleName = builder.ruleName;
        this.ruleType = builder.ruleType != null ? builder.ruleType : RuleType.UNKNOWN;
        this.action = builder.action != null ? builder.action : WafAction.UNKNOWN;
        this.service = builder.service;
        this.mitigationReason = builder.mitigationReason;
        this.userAgent = builder.userAgent;
        this.ja3 = builder.ja3;
        this.bytes = builder.bytes;
        this.threatScore = builder.threatScore;
        this.fileId = builder.fileId;
        this.ingestedAt = builder.ingestedAt;
    }

    /**
     * Builder pattern for creating WafEvent instances
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String rayId;
        private long eventTs;
        private String srcIp;
        private String srcCountry;
        private Long srcAsn;
        private String colo;
        private String host;
        private String path;
        private String method;
        private Integer status;
        private String ruleId;
        private String ruleName;
        private RuleType ruleType;
        private WafAction action;
        private String service;
        private String mitigationReason;
        private String userAgent;
        private String ja3;
        private Long bytes;
        private Long threatScore;
        private Long fileId;
        private Long ingestedAt;

        public Builder rayId(String rayId) {
            this.rayId = rayId;
            return this;
        }

        public Builder eventTs(long eventTs) {
            this.eventTs = eventTs;
            return this;
        }

        public Builder srcIp(String srcIp) {
            this.srcIp = srcIp;
            return this;
        }

        public Builder srcCountry(String srcCountry) {
            this.srcCountry = srcCountry;
            return this;
        }

        public Builder srcAsn(Long srcAsn) {
            this.srcAsn = srcAsn;
            return this;
        }

        public Builder colo(String colo) {
            this.colo = colo;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder status(Integer status) {
            this.status = status;
            return this;
        }

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder ruleName(String ruleName) {
            this.ruleName = ruleName;
            return this;
        }

        public Builder ruleType(RuleType ruleType) {
            this.ruleType = ruleType;
            return this;
        }

        public Builder action(WafAction action) {
            this.action = action;
            return this;
        }

        public Builder service(String service) {
            this.service = service;
            return this;
        }

        public Builder mitigationReason(String mitigationReason) {
            this.mitigationReason = mitigationReason;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder ja3(String ja3) {
            this.ja3 = ja3;
            return this;
        }

        public Builder bytes(Long bytes) {
            this.bytes = bytes;
            return this;
        }

        public Builder threatScore(Long threatScore) {
            this.threatScore = threatScore;
            return this;
        }

        public Builder fileId(Long fileId) {
            this.fileId = fileId;
            return this;
        }

        public Builder ingestedAt(Long ingestedAt) {
            this.ingestedAt = ingestedAt;
            return this;
        }

        /**
         * Build the event.
         *
         * @return the immutable event
         * @throws IllegalStateException if the ray id is missing
         */
        public WafEvent build() {
            if (rayId == null || rayId.isEmpty()) {
                throw new IllegalStateException("Ray ID must not be null or empty");
            }
            return new WafEvent(this);
        }
    }

    public String getRayId() {
        return rayId;
    }

    public long getEventTs() {
        return eventTs;
    }

    public String getSrcIp() {
        return srcIp;
    }

    public String getSrcCountry() {
        return srcCountry;
    }

    public Long getSrcAsn() {
        return srcAsn;
    }

    public String getColo() {
        return colo;
    }

    public String getHost() {
        return host;
    }

    public String getPath() {
        return path;
    }

    public String getMethod() {
        return method;
    }

    public Integer getStatus() {
        return status;
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

    public WafAction getAction() {
        return action;
    }

    public String getService() {
        return service;
    }

    public String getMitigationReason() {
        return mitigationReason;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public String getJa3() {
        return ja3;
    }

    public Long getBytes() {
        return bytes;
    }

    public Long getThreatScore() {
        return threatScore;
    }

    public Long getFileId() {
        return fileId;
    }

    public Long getIngestedAt() {
        return ingestedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WafEvent)) {
            return false;
        }
        WafEvent other = (WafEvent) o;
        return eventTs == other.eventTs && rayId.equals(other.rayId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rayId, eventTs);
    }

    @Override
    public String toString() {
        return "WafEvent{" +
                "rayId='" + rayId + '\'' +
                ", eventTs=" + eventTs +
                ", action=" + action +
                ", ruleId='" + ruleId + '\'' +
                ", srcIp='" + srcIp + '\'' +
                '}';
    }
}
