package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Dashboard overview of the events in a time range
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Summary {

    @JsonProperty("start_time")
    private final long startTime;

    @JsonProperty("end_time")
    private final long endTime;

    @JsonProperty("total_events")
    private final long totalEvents;

    @JsonProperty("unique_ips")
    private final long uniqueIps;

    /**
     * Share of blocked and challenged events, 0..100
     */
    @JsonProperty("blocked_percentage")
    private final double blockedPercentage;

    /**
     * Most matched rule since the start of the current UTC day, absent when none matched
     */
    @JsonProperty("top_rule_today")
    private final TopRule topRuleToday;

    @JsonProperty("actions_breakdown")
    private final Map<String, Long> actionsBreakdown;

    @JsonProperty("top_rules")
    private final List<TopRule> topRules;

    @JsonProperty("top_hosts")
    private final List<HostCount> topHosts;

    @JsonProperty("top_paths")
    private final List<AttackPath> topPaths;

    @JsonProperty("geo_distribution")
    private final Map<String, Long> geoDistribution;

    @JsonProperty("time_series")
    private final List<TimeSeriesPoint> timeSeries;

    private Summary(Builder builder) {
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.totalEvents = builder.totalEvents;
        this.uniqueIps = builder.uniqueIps;
        this.blockedPercentage = builder.blockedPercentage;
        this.topRuleToday = builder.topRuleToday;
        this.actionsBreakdown = builder.actionsBreakdown;
        this.topRules = builder.topRules;
        this.topHosts = builder.topHosts;
        this.topPaths = builder.topPaths;
        this.geoDistribution = builder.geoDistribution;
        this.timeSeries = builder.timeSeries;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long startTime;
        private long endTime;
        private long totalEvents;
        private long uniqueIps;
        private double blockedPercentage;
        private TopRule topRuleToday;
        private Map<String, Long> actionsBreakdown = Map.of();
        private List<TopRule> topRules = List.of();
        private List<HostCount> topHosts = List.of();
        private List<AttackPath> topPaths = List.of();
        private Map<String, Long> geoDistribution = Map.of();
        private List<TimeSeriesPoint> timeSeries = List.of();

        public Builder range(long startTime, long endTime) {
            this.startTime = startTime;
            this.endTime = endTime;
            return this;
        }

        public Builder totalEvents(long totalEvents) {
            this.totalEvents = totalEvents;
            return this;
        }

        public Builder uniqueIps(long uniqueIps) {
            this.uniqueIps = uniqueIps;
            return this;
        }

        public Builder blockedPercentage(double blockedPercentage) {
            this.blockedPercentage = blockedPercentage;
            return this;
        }

        public Builder topRuleToday(TopRule topRuleToday) {
            this.topRuleToday = topRuleToday;
            return this;
        }

        public Builder actionsBreakdown(Map<String, Long> actionsBreakdown) {
            this.actionsBreakdown = actionsBreakdown;
            return this;
        }

        public Builder topRules(List<TopRule> topRules) {
            this.topRules = topRules;
            return this;
        }

        public Builder topHosts(List<HostCount> topHosts) {
            this.topHosts = topHosts;
            return this;
        }

        public Builder topPaths(List<AttackPath> topPaths) {
            this.topPaths = topPaths;
            return this;
        }

        public Builder geoDistribution(Map<String, Long> geoDistribution) {
            this.geoDistribution = geoDistribution;
            return this;
        }

        public Builder timeSeries(List<TimeSeriesPoint> timeSeries) {
            this.timeSeries = timeSeries;
            return this;
        }

        public Summary build() {
            return new Summary(this);
        }
    }

    public long getStartTime() {
        return startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    public long getTotalEvents() {
        return totalEvents;
    }

    public long getUniqueIps() {
        return uniqueIps;
    }

    public double getBlockedPercentage() {
        return blockedPercentage;
    }

    public TopRule getTopRuleToday() {
        return topRuleToday;
    }

    public Map<String, Long> getActionsBreakdown() {
        return actionsBreakdown;
    }

    public List<TopRule> getTopRules() {
        return topRules;
    }

    public List<HostCount> getTopHosts() {
        return topHosts;
    }

    public List<AttackPath> getTopPaths() {
        return topPaths;
    }

    public Map<String, Long> getGeoDistribution() {
        return geoDistribution;
    }

    public List<TimeSeriesPoint> getTimeSeries() {
        return timeSeries;
    }
}
