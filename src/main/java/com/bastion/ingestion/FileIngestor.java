package com.bastion.ingestion;

import com.bastion.normalization.ContentParser;
import com.bastion.normalization.ParsedContent;
import com.bastion.storage.BatchWriteOutcome;
import com.bastion.storage.EventBatchWriter;
import com.bastion.storage.IngestionMetrics;
import com.bastion.storage.UploadRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Parses file content and writes its events under an existing upload.
 *
 * The upload counters are overwritten after every committed chunk, so a
 * failure part-way leaves them matching what is actually stored.
 */
@Component
public class FileIngestor {
    private static final Logger logger = LoggerFactory.getLogger(FileIngestor.class);

    private final ContentParser contentParser;
    private final EventBatchWriter batchWriter;
    private final UploadRepository uploadRepository;
    private final IngestionMetrics metrics;

    public FileIngestor(
            ContentParser contentParser,
            EventBatchWriter batchWriter,
            UploadRepository uploadRepository,
            IngestionMetrics metrics) {
        this.contentParser = contentParser;
        this.batchWriter = batchWriter;
        this.uploadRepository = uploadRepository;
        this.metrics = metrics;
    }

    public FileIngestion ingest(long fileId, String content) {
        ParsedContent parsed = contentParser.parse(content);
        int total = parsed.getEvents().size();

        metrics.recordParseErrors(parsed.getErrors().size());
        logger.info("Parsed {} events from file {} ({}), {} errors, {} skipped",
            total, fileId, parsed.getFormat(), parsed.getErrors().size(), parsed.getSkipped());

        if (parsed.isEmpty()) {
            uploadRepository.updateCounters(fileId, 0, 0, 0);
            return new FileIngestion(parsed, null);
        }

        BatchWriteOutcome outcome = batchWriter.write(parsed.getEvents(), fileId,
            tally -> uploadRepository.updateCounters(fileId, total, tally.getInserted(), tally.getDeduped()));

        if (outcome.isComplete()) {
            logger.info("Stored file {}: {} inserted, {} deduped", fileId, outcome.getInserted(), outcome.getDeduped());
        } else {
            logger.warn("Stored file {} partially: {} inserted, {} deduped, {} unprocessed",
                fileId, outcome.getInserted(), outcome.getDeduped(), outcome.getUnprocessed());
        }

        return new FileIngestion(parsed, outcome);
    }
}
