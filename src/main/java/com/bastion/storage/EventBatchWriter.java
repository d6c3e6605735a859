package com.bastion.storage;

import com.bastion.domain.WafEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.function.Consumer;

/**
 * Writes normalized events to the event store in fixed-size chunks.
 *
 * Each chunk is one transaction of insert-or-ignore statements keyed on
 * (ray_id, event_ts), so re-sending an event is a no-op that shows up as a
 * dedup rather than an error. A failing chunk stops the remaining chunks of the
 * file; chunks already committed are kept and reported.
 */
@Service
public class EventBatchWriter {
    private static final Logger logger = LoggerFactory.getLogger(EventBatchWriter.class);

    private final EventRepository eventRepository;
    private final TransactionTemplate transactionTemplate;
    private final IngestionMetrics metrics;
    private final int batchSize;

    public EventBatchWriter(
            EventRepository eventRepository,
            TransactionTemplate transactionTemplate,
            IngestionMetrics metrics,
            @Value("${bastion.ingestion.batch-size:1000}") int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        this.eventRepository = eventRepository;
        this.transactionTemplate = transactionTemplate;
        this.metrics = metrics;
        this.batchSize = batchSize;
    }

    /**
     * Write all events of one file.
     *
     * @param events normalized events, in file order
     * @param fileId owning upload
     * @param progress called with the accumulated tally after every committed chunk
     * @return the accumulated tally, with the failure if a chunk could not be written
     */
    public BatchWriteOutcome write(List<WafEvent> events, long fileId, Consumer<BatchTally> progress) {
        BatchTally accumulated = BatchTally.empty();

        for (int from = 0; from < events.size(); from += batchSize) {
            List<WafEvent> chunk = events.subList(from, Math.min(from + batchSize, events.size()));

            try {
                BatchTally chunkTally = writeChunk(chunk, fileId);
                accumulated = accumulated.plus(chunkTally);

                logger.debug("File {} chunk {}: {} inserted, {} deduped",
                    fileId, accumulated.getChunks(), chunkTally.getInserted(), chunkTally.getDeduped());

                progress.accept(accumulated);

            } catch (RuntimeException e) {
                metrics.recordChunkFailure();
                logger.error("Chunk write failed for file {} at offset {}; {} events left unprocessed",
                    fileId, from, events.size() - accumulated.getProcessed(), e);
                return BatchWriteOutcome.failed(accumulated, events.size(), e);
            }
        }

        return BatchWriteOutcome.completed(accumulated, events.size());
    }

    private BatchTally writeChunk(List<WafEvent> chunk, long fileId) {
        long started = System.currentTimeMillis();
        long ingestedAt = started;

        int[] updateCounts = transactionTemplate.execute(status ->
            eventRepository.insertOrIgnore(chunk, fileId, ingestedAt));

        BatchTally tally = BatchTally.ofUpdateCounts(updateCounts != null ? updateCounts : new int[0]);
        metrics.recordChunk(tally, System.currentTimeMillis() - started);
        return tally;
    }
}
