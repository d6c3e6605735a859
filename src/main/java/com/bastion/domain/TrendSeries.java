package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Gap-free series of bucketed event counts over a time range
 */
public class TrendSeries {

    @JsonProperty("bucket")
    private final TrendBucket bucket;

    @JsonProperty("start_time")
    private final long startTime;

    @JsonProperty("end_time")
    private final long endTime;

    @JsonProperty("data")
    private final List<TimeSeriesPoint> data;

    public TrendSeries(TrendBucket bucket, long startTime, long endTime, List<TimeSeriesPoint> data) {
        this.bucket = bucket;
        this.startTime = startTime;
        this.endTime = endTime;
        this.data = data;
    }

    public TrendBucket getBucket() {
        return bucket;
    }

    @JsonProperty("bucket_size")
    public long getBucketSize() {
        return bucket.getSizeMillis();
    }

    public long getStartTime() {
        return startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    public List<TimeSeriesPoint> getData() {
        return data;
    }
}
