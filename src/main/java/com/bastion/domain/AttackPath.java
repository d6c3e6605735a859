package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Path rollup row keyed by (path, method, status)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AttackPath {

    @JsonProperty("path")
    private final String path;

    @JsonProperty("method")
    private final String method;

    @JsonProperty("status")
    private final Integer status;

    @JsonProperty("count")
    private final long count;

    @JsonProperty("last_seen")
    private final Long lastSeen;

    public AttackPath(String path, String method, Integer status, long count, Long lastSeen) {
        this.path = path;
        this.method = method;
        this.status = status;
        this.count = count;
        this.lastSeen = lastSeen;
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

    public long getCount() {
        return count;
    }

    public Long getLastSeen() {
        return lastSeen;
    }
}
