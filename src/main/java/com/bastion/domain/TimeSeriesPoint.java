package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Event counts of one time bucket, per action.
 *
 * Serialized flat: {"timestamp": ..., "total": ..., "block": ..., "challenge": ...}.
 * Every action appears, with zero when the bucket holds none of it.
 */
public class TimeSeriesPoint {

    @JsonProperty("timestamp")
    private final long timestamp;

    private final EnumMap<WafAction, Long> counts = new EnumMap<>(WafAction.class);

    public TimeSeriesPoint(long timestamp) {
        this.timestamp = timestamp;
        for (WafAction action : WafAction.values()) {
            counts.put(action, 0L);
        }
    }

    public void add(WafAction action, long count) {
        counts.merge(action, count, Long::sum);
    }

    public long getTimestamp() {
        return timestamp;
    }

    @JsonProperty("total")
    public long getTotal() {
        long total = 0;
        for (long count : counts.values()) {
            total += count;
        }
        return total;
    }

    public long getCount(WafAction action) {
        return counts.get(action);
    }

    @JsonAnyGetter
    public Map<String, Long> getActionCounts() {
        Map<String, Long> byName = new LinkedHashMap<>();
        counts.forEach((action, count) -> byName.put(action.getValue(), count));
        return byName;
    }
}
