package com.bastion.ingestion;

import com.bastion.analytics.RollupKeys;
import com.bastion.analytics.RollupUpdater;
import com.bastion.domain.Upload;
import com.bastion.domain.UploadResult;
import com.bastion.domain.UploadStatus;
import com.bastion.ingestion.RawContentNotAvailableException.Reason;
import com.bastion.storage.BatchWriteOutcome;
import com.bastion.storage.EventRepository;
import com.bastion.storage.IngestionMetrics;
import com.bastion.storage.UploadRepository;
import com.bastion.storage.blob.RawContentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Re-ingests a previously uploaded file from its retained raw content.
 *
 * The file's events are replaced, then every rollup bucket fed by the old or
 * the new events is recomputed from the event table. Reindexing the same file
 * any number of times leaves the rollups as they would be after one ingest.
 */
@Service
public class ReindexService {
    private static final Logger logger = LoggerFactory.getLogger(ReindexService.class);

    private final UploadRepository uploadRepository;
    private final EventRepository eventRepository;
    private final FileIngestor fileIngestor;
    private final RollupUpdater rollupUpdater;
    private final Optional<RawContentStore> rawContentStore;
    private final IngestionMetrics metrics;

    public ReindexService(
            UploadRepository uploadRepository,
            EventRepository eventRepository,
            FileIngestor fileIngestor,
            RollupUpdater rollupUpdater,
            Optional<RawContentStore> rawContentStore,
            IngestionMetrics metrics) {
        this.uploadRepository = uploadRepository;
        this.eventRepository = eventRepository;
        this.fileIngestor = fileIngestor;
        this.rollupUpdater = rollupUpdater;
        this.rawContentStore = rawContentStore;
        this.metrics = metrics;
    }

    /**
     * @throws IllegalArgumentException if the request names neither a checksum nor a file id
     * @throws UploadNotFoundException if no such upload exists
     * @throws RawContentNotAvailableException if the raw content cannot be fetched
     */
    public UploadResult reindex(ReindexRequest request) {
        Upload upload = resolve(request);
        long fileId = upload.getId();
        String content = loadRawContent(upload);

        logger.info("Reindexing upload {} ({})", fileId, upload.getFilename());

        RollupKeys previousKeys = rollupUpdater.collectKeys(fileId);
        int removed = eventRepository.deleteByFileId(fileId);
        logger.debug("Removed {} events of upload {} before reindex", removed, fileId);

        FileIngestion ingestion = fileIngestor.ingest(fileId, content);

        RollupKeys keys = previousKeys.union(rollupUpdater.collectKeys(fileId));
        rollupUpdater.refreshBuckets(keys);

        UploadResult.Builder result = UploadResult.builder()
            .filename(upload.getFilename())
            .checksum(upload.getChecksum())
            .fileId(fileId)
            .total(ingestion.getTotal())
            .inserted(ingestion.getTally().getInserted())
            .deduped(ingestion.getTally().getDeduped())
            .errors(ingestion.getParsed().getErrors())
            .timeRange(ingestion.getTimeRange());

        if (!ingestion.hasEvents()) {
            result.status(UploadStatus.NO_VALID_EVENTS);
        } else if (!ingestion.isWriteComplete()) {
            BatchWriteOutcome outcome = ingestion.getWriteOutcome();
            result.status(UploadStatus.ERROR).error(UploadService.storageFailureMessage(outcome));
        } else {
            result.status(UploadStatus.SUCCESS);
        }

        UploadResult built = result.build();
        metrics.recordFile(built.getStatus().getValue());
        logger.info("Reindexed upload {}: status={}, inserted={}, deduped={}",
            fileId, built.getStatus(), built.getInserted(), built.getDeduped());
        return built;
    }

    private Upload resolve(ReindexRequest request) {
        if (request == null || (!request.hasChecksum() && !request.hasFileId())) {
            throw new IllegalArgumentException("Either checksum or file_id is required");
        }

        if (request.hasChecksum()) {
            return uploadRepository.findByChecksum(request.getChecksum())
                .orElseThrow(() -> new UploadNotFoundException("checksum " + request.getChecksum()));
        }
        return uploadRepository.findById(request.getFileId())
            .orElseThrow(() -> new UploadNotFoundException("file_id " + request.getFileId()));
    }

    private String loadRawContent(Upload upload) {
        if (rawContentStore.isEmpty()) {
            throw new RawContentNotAvailableException(upload.getId(), Reason.RETENTION_DISABLED,
                "Raw file retention is disabled; upload cannot be reprocessed");
        }
        if (upload.getRawKey() == null || upload.getRawKey().isEmpty()) {
            throw new RawContentNotAvailableException(upload.getId(), Reason.NOT_RETAINED,
                "Raw file not available for reprocessing");
        }
        return rawContentStore.get().get(upload.getRawKey())
            .orElseThrow(() -> new RawContentNotAvailableException(upload.getId(), Reason.MISSING,
                "Raw file not found in blob store: " + upload.getRawKey()));
    }
}
