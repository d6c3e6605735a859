package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * Source IP rollup row, with every country and ASN the address was seen from
 */
public class TopIp {

    @JsonProperty("src_ip")
    private final String srcIp;

    @JsonProperty("count")
    private final long count;

    @JsonProperty("countries")
    private final List<String> countries;

    @JsonProperty("asns")
    private final List<Long> asns;

    @JsonProperty("last_seen")
    private final Long lastSeen;

    public TopIp(String srcIp, long count, List<String> countries, List<Long> asns, Long lastSeen) {
        this.srcIp = srcIp;
        this.count = count;
        this.countries = countries != null ? List.copyOf(countries) : Collections.emptyList();
        this.asns = asns != null ? List.copyOf(asns) : Collections.emptyList();
        this.lastSeen = lastSeen;
    }

    public String getSrcIp() {
        return srcIp;
    }

    public long getCount() {
        return count;
    }

    public List<String> getCountries() {
        return countries;
    }

    public List<Long> getAsns() {
        return asns;
    }

    public Long getLastSeen() {
        return lastSeen;
    }
}
