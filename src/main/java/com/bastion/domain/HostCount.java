package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public class HostCount {

    @JsonProperty("host")
    private final String host;

    @JsonProperty("count")
    private final long count;

    public HostCount(String host, long count) {
        this.host = host;
        this.count = count;
    }

    public String getHost() {
        return host;
    }

    public long getCount() {
        return count;
    }
}
