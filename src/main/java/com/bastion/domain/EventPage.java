package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Newest events matching an {@link EventQuery}, with the full match count
 */
public class EventPage {

    @JsonProperty("events")
    private final List<WafEvent> events;

    @JsonProperty("total")
    private final long total;

    @JsonProperty("limit")
    private final int limit;

    public EventPage(List<WafEvent> events, long total, int limit) {
        this.events = events;
        this.total = total;
        this.limit = limit;
    }

    public List<WafEvent> getEvents() {
        return events;
    }

    public long getTotal() {
        return total;
    }

    public int getLimit() {
        return limit;
    }
}
