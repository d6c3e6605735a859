package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;

/**
 * Width of the time buckets of an event trend
 */
public enum TrendBucket {

    MINUTE("minute", Duration.ofMinutes(1)),
    HOUR("hour", Duration.ofHours(1)),
    DAY("day", Duration.ofDays(1));

    private final String value;
    private final long sizeMillis;

    TrendBucket(String value, Duration size) {
        this.value = value;
        this.sizeMillis = size.toMillis();
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public long getSizeMillis() {
        return sizeMillis;
    }

    /**
     * Start of the bucket holding a timestamp
     */
    public long floor(long epochMillis) {
        return Math.floorDiv(epochMillis, sizeMillis) * sizeMillis;
    }

    /**
     * @throws IllegalArgumentException for anything but minute, hour or day
     */
    public static TrendBucket fromValue(String value) {
        for (TrendBucket bucket : values()) {
            if (bucket.value.equalsIgnoreCase(value)) {
                return bucket;
            }
        }
        throw new IllegalArgumentException("Unknown trend bucket: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
