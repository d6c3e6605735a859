package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Number of events with a given action on a given UTC day
 */
public class DailyActionCount {

    /**
     * ISO date, yyyy-MM-dd
     */
    @JsonProperty("date")
    private final String date;

    @JsonProperty("action")
    private final WafAction action;

    @JsonProperty("count")
    private final long count;

    public DailyActionCount(String date, WafAction action, long count) {
        this.date = date;
        this.action = action;
        this.count = count;
    }

    public String getDate() {
        return date;
    }

    public WafAction getAction() {
        return action;
    }

    public long getCount() {
        return count;
    }
}
