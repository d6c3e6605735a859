package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collection;

/**
 * Earliest and latest event timestamps of a set of events
 */
public class TimeRange {
    private final long earliest;
    private final long latest;

    public TimeRange(long earliest, long latest) {
        this.earliest = earliest;
        this.latest = latest;
    }

    /**
     * Compute the range covered by the given events.
     *
     * @param events events to scan
     * @return the range, or null when there are no events
     */
    public static TimeRange of(Collection<WafEvent> events) {
        if (events == null || events.isEmpty()) {
            return null;
        }
        long min = Long.MAX_VALUE;
        long max = Long.MIN_VALUE;
        for (WafEvent event : events) {
            min = Math.min(min, event.getEventTs());
            max = Math.max(max, event.getEventTs());
        }
        return new TimeRange(min, max);
    }

    @JsonIgnore
    public long getEarliestMillis() {
        return earliest;
    }

    @JsonIgnore
    public long getLatestMillis() {
        return latest;
    }

    @JsonProperty("earliest")
    public String getEarliestIso() {
        return Instant.ofEpochMilli(earliest).toString();
    }

    @JsonProperty("latest")
    public String getLatestIso() {
        return Instant.ofEpochMilli(latest).toString();
    }
}
