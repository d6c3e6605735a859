package com.bastion.storage;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Metrics collector for event ingestion
 */
@Component
public class IngestionMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter eventsInserted;
    private final Counter eventsDeduped;
    private final Counter chunkFailures;
    private final Counter parseErrors;
    private final Timer chunkLatency;
    private final Timer rollupLatency;
    private final Map<String, Counter> filesByStatus = new ConcurrentHashMap<>();

    public IngestionMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        eventsInserted = Counter.builder("bastion.ingestion.events.inserted")
            .description("Total number of events written to the event store")
            .register(meterRegistry);

        eventsDeduped = Counter.builder("bastion.ingestion.events.deduped")
            .description("Total number of events suppressed as duplicates")
            .register(meterRegistry);

        chunkFailures = Counter.builder("bastion.ingestion.chunk.failures")
            .description("Total number of chunk writes that failed")
            .register(meterRegistry);

        parseErrors = Counter.builder("bastion.ingestion.parse.errors")
            .description("Total number of records that could not be decoded")
            .register(meterRegistry);

        chunkLatency = Timer.builder("bastion.ingestion.chunk.latency")
            .description("Latency of chunk writes")
            .register(meterRegistry);

        rollupLatency = Timer.builder("bastion.ingestion.rollup.latency")
            .description("Latency of rollup updates")
            .register(meterRegistry);
    }

    public void recordChunk(BatchTally chunk, long millis) {
        eventsInserted.increment(chunk.getInserted());
        eventsDeduped.increment(chunk.getDeduped());
        chunkLatency.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordChunkFailure() {
        chunkFailures.increment();
    }

    public void recordParseErrors(int count) {
        parseErrors.increment(count);
    }

    public void recordRollup(long millis) {
        rollupLatency.record(millis, TimeUnit.MILLISECONDS);
    }

    /**
     * Count a processed file by its outcome status
     */
    public void recordFile(String status) {
        filesByStatus.computeIfAbsent(status, s ->
            Counter.builder("bastion.ingestion.files")
                .tag("status", s)
                .description("Number of processed files by outcome")
                .register(meterRegistry)
        ).increment();
    }
}
