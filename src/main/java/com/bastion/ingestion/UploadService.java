package com.bastion.ingestion;

import com.bastion.analytics.RollupUpdater;
import com.bastion.domain.TimeRange;
import com.bastion.domain.Upload;
import com.bastion.domain.UploadResult;
import com.bastion.domain.UploadStatus;
import com.bastion.storage.BatchWriteOutcome;
import com.bastion.storage.EventRepository;
import com.bastion.storage.IngestionMetrics;
import com.bastion.storage.UploadRepository;
import com.bastion.storage.blob.RawContentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ingests uploaded WAF export files.
 *
 * Files are identified by content checksum. A file already ingested with at
 * least one inserted event is reported as already processed; one that inserted
 * nothing is dropped and processed again.
 */
@Service
public class UploadService {
    private static final Logger logger = LoggerFactory.getLogger(UploadService.class);

    static final String ALREADY_PROCESSED_NOTE = "File was already processed. Use /api/reindex to reprocess.";
    static final String OUTSIDE_DEFAULT_WINDOW_NOTE =
        "Events are outside the default 24-hour dashboard view. Adjust the date range to see them.";

    static final String ROLLUP_FAILURE_MESSAGE =
        "Stored %d events but the rollup update failed (%s). Run a rollup rebuild.";

    private static final long DEFAULT_WINDOW_MILLIS = Duration.ofHours(24).toMillis();

    private final ChecksumCalculator checksumCalculator;
    private final UploadRepository uploadRepository;
    private final EventRepository eventRepository;
    private final FileIngestor fileIngestor;
    private final RollupUpdater rollupUpdater;
    private final Optional<RawContentStore> rawContentStore;
    private final IngestionMetrics metrics;
    private final long maxFileSizeBytes;

    public UploadService(
            ChecksumCalculator checksumCalculator,
            UploadRepository uploadRepository,
            EventRepository eventRepository,
            FileIngestor fileIngestor,
            RollupUpdater rollupUpdater,
            Optional<RawContentStore> rawContentStore,
            IngestionMetrics metrics,
            @Value("${bastion.ingestion.max-file-size-mb:50}") int maxFileSizeMb) {
        this.checksumCalculator = checksumCalculator;
        this.uploadRepository = uploadRepository;
        this.eventRepository = eventRepository;
        this.fileIngestor = fileIngestor;
        this.rollupUpdater = rollupUpdater;
        this.rawContentStore = rawContentStore;
        this.metrics = metrics;
        this.maxFileSizeBytes = maxFileSizeMb * 1024L * 1024L;
    }

    /**
     * Process multipart files one after another. A failing file never stops its siblings.
     */
    public List<UploadResult> processFiles(List<MultipartFile> files) {
        List<UploadResult> results = new ArrayList<>(files.size());

        for (MultipartFile file : files) {
            String filename = file.getOriginalFilename() != null ? file.getOriginalFilename() : file.getName();

            if (file.getSize() > maxFileSizeBytes) {
                results.add(reject(filename, String.format("File size %d exceeds maximum %d bytes",
                    file.getSize(), maxFileSizeBytes)));
                continue;
            }

            String content;
            try {
                content = new String(file.getBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                logger.error("Failed to read uploaded file {}", filename, e);
                results.add(reject(filename, "Failed to read file: " + e.getMessage()));
                continue;
            }

            results.add(processFile(filename, content, file.getSize()));
        }

        return results;
    }

    /**
     * Process one file's content.
     *
     * @param filename name reported back to the caller
     * @param content file content
     * @param size file size in bytes
     * @return per-file statistics, never null
     */
    public UploadResult processFile(String filename, String content, long size) {
        if (size > maxFileSizeBytes) {
            return reject(filename, String.format("File size %d exceeds maximum %d bytes", size, maxFileSizeBytes));
        }

        String checksum = checksumCalculator.checksum(content);
        try {
            UploadResult result = ingestNew(filename, checksum, content, size);
            metrics.recordFile(result.getStatus().getValue());
            return result;

        } catch (RuntimeException e) {
            logger.error("Processing failed for file {} ({})", filename, checksum, e);
            metrics.recordFile(UploadStatus.ERROR.getValue());
            return failedResult(filename, checksum, e);
        }
    }

    /**
     * Error result carrying whatever the upload row recorded before the
     * failure, so that events already committed are never reported as zero.
     */
    private UploadResult failedResult(String filename, String checksum, RuntimeException failure) {
        UploadResult.Builder result = UploadResult.builder()
            .filename(filename)
            .checksum(checksum)
            .status(UploadStatus.ERROR)
            .error(failure.getMessage() != null ? failure.getMessage() : "Processing failed");

        Optional<Upload> stored;
        try {
            stored = uploadRepository.findByChecksum(checksum);
        } catch (RuntimeException e) {
            logger.warn("Could not read counters of failed file {} ({})", filename, checksum, e);
            return result.build();
        }

        stored.ifPresent(upload -> result
            .fileId(upload.getId())
            .total(upload.getTotalRecords())
            .inserted(upload.getInsertedRecords())
            .deduped(upload.getDedupedRecords()));
        return result.build();
    }

    private UploadResult ingestNew(String filename, String checksum, String content, long size) {
        Optional<Upload> existing = uploadRepository.findByChecksum(checksum);

        if (existing.isPresent()) {
            Upload upload = existing.get();
            if (!upload.isRetryable()) {
                logger.info("File {} already processed as upload {}", filename, upload.getId());
                return UploadResult.builder()
                    .filename(filename)
                    .checksum(checksum)
                    .fileId(upload.getId())
                    .status(UploadStatus.ALREADY_PROCESSED)
                    .total(upload.getTotalRecords())
                    .inserted(upload.getInsertedRecords())
                    .deduped(upload.getDedupedRecords())
                    .note(ALREADY_PROCESSED_NOTE)
                    .build();
            }

            logger.info("File {} was uploaded before with no inserted events, reprocessing", filename);
            eventRepository.deleteByFileId(upload.getId());
            uploadRepository.deleteById(upload.getId());
        }

        Upload upload = uploadRepository.create(new Upload(filename, checksum, size, System.currentTimeMillis()));
        long fileId = upload.getId();

        if (rawContentStore.isPresent()) {
            String rawKey = RawContentStore.keyFor(checksum);
            rawContentStore.get().put(rawKey, content);
            uploadRepository.updateRawKey(fileId, rawKey);
        }

        FileIngestion ingestion = fileIngestor.ingest(fileId, content);

        if (!ingestion.hasEvents()) {
            return UploadResult.builder()
                .filename(filename)
                .checksum(checksum)
                .fileId(fileId)
                .status(UploadStatus.NO_VALID_EVENTS)
                .errors(ingestion.getParsed().getErrors())
                .build();
        }

        BatchWriteOutcome outcome = ingestion.getWriteOutcome();

        if (!outcome.isComplete()) {
            applyRollup(fileId, outcome.getInserted());
            return UploadResult.builder()
                .filename(filename)
                .checksum(checksum)
                .fileId(fileId)
                .status(UploadStatus.ERROR)
                .total(ingestion.getTotal())
                .inserted(outcome.getInserted())
                .deduped(outcome.getDeduped())
                .errors(ingestion.getParsed().getErrors())
                .error(storageFailureMessage(outcome))
                .build();
        }

        String rollupFailure = applyRollup(fileId, outcome.getInserted());

        TimeRange timeRange = ingestion.getTimeRange();
        return UploadResult.builder()
            .filename(filename)
            .checksum(checksum)
            .fileId(fileId)
            .status(rollupFailure == null ? UploadStatus.SUCCESS : UploadStatus.ERROR)
            .total(ingestion.getTotal())
            .inserted(outcome.getInserted())
            .deduped(outcome.getDeduped())
            .errors(ingestion.getParsed().getErrors())
            .timeRange(timeRange)
            .note(outsideDefaultWindow(timeRange) ? OUTSIDE_DEFAULT_WINDOW_NOTE : null)
            .error(rollupFailure)
            .build();
    }

    /**
     * Fold an upload's stored events into the rollups. The events stay
     * committed when this fails; a rollup rebuild recovers the aggregates.
     *
     * @return null on success, otherwise the message for the file result
     */
    private String applyRollup(long fileId, long inserted) {
        if (inserted == 0) {
            return null;
        }
        try {
            rollupUpdater.applyUpload(fileId);
            return null;
        } catch (RuntimeException e) {
            logger.error("Rollup update failed for file {}; run a rollup rebuild", fileId, e);
            return String.format(ROLLUP_FAILURE_MESSAGE, inserted, e.getMessage());
        }
    }

    static String storageFailureMessage(BatchWriteOutcome outcome) {
        String cause = outcome.getFailure().getMessage() != null
            ? outcome.getFailure().getMessage()
            : outcome.getFailure().getClass().getSimpleName();
        return String.format("Storage failure after %d of %d events: %s",
            outcome.getTally().getProcessed(), outcome.getTotal(), cause);
    }

    private static boolean outsideDefaultWindow(TimeRange timeRange) {
        return timeRange != null && timeRange.getEarliestMillis() < System.currentTimeMillis() - DEFAULT_WINDOW_MILLIS;
    }

    private UploadResult reject(String filename, String message) {
        logger.warn("Rejected file {}: {}", filename, message);
        metrics.recordFile(UploadStatus.ERROR.getValue());
        return UploadResult.rejected(filename, message);
    }
}
