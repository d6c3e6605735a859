package com.bastion.ingestion;

import com.bastion.analytics.RollupUpdater;
import com.bastion.domain.TopRule;
import com.bastion.domain.Upload;
import com.bastion.domain.UploadResult;
import com.bastion.domain.UploadStatus;
import com.bastion.normalization.ContentParser;
import com.bastion.normalization.WafRecordNormalizer;
import com.bastion.storage.BatchTally;
import com.bastion.storage.BatchWriteOutcome;
import com.bastion.storage.EventBatchWriter;
import com.bastion.storage.blob.InMemoryRawContentStore;
import com.bastion.storage.blob.RawContentStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * End-to-end tests of file ingestion over a real SQLite store.
 */
@DisplayName("UploadService Tests")
class UploadServiceTest {

    private static final int BATCH_SIZE = 25;

    private static final String TWO_VALID_ONE_INVALID = """
        {"RayID":"8a1","EdgeStartTimestamp":1700000000000,"ClientIP":"192.0.2.1","ClientCountry":"DE","action":"block","FirewallMatchesRuleIDs":["managed_sqli"],"ClientRequestPath":"/login","ClientRequestMethod":"POST","EdgeResponseStatus":403}
        this is not json
        {"rayId":"8a2","timestamp":"2023-11-14T22:14:00Z","clientIP":"192.0.2.2","action":"Challenged","ruleId":"custom_geo"}
        """;

    @TempDir
    Path tempDir;

    private IngestionFixture fixture;
    private UploadService uploadService;

    @BeforeEach
    void setUp() {
        fixture = new IngestionFixture(tempDir, BATCH_SIZE);
        uploadService = fixture.uploadService(null, 50);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private static String ndjson(String prefix, int count, long baseTs) {
        return IntStream.range(0, count)
            .mapToObj(i -> String.format("{\"RayID\":\"%s-%d\",\"EdgeStartTimestamp\":%d,\"action\":\"block\"}",
                prefix, i, baseTs + i))
            .collect(Collectors.joining("\n"));
    }

    private UploadResult upload(String filename, String content) {
        return uploadService.processFile(filename, content, content.getBytes(StandardCharsets.UTF_8).length);
    }

    @Test
    @DisplayName("Should ingest two valid records and report the invalid line")
    void shouldIngestNdjsonWithInvalidLine() {
        // When
        UploadResult result = upload("events.ndjson", TWO_VALID_ONE_INVALID);

        // Then
        assertThat(result.getStatus()).isEqualTo(UploadStatus.SUCCESS);
        assertThat(result.getTotal()).isEqualTo(2);
        assertThat(result.getInserted()).isEqualTo(2);
        assertThat(result.getDeduped()).isZero();
        assertThat(result.getErrors()).hasSize(1);
        assertThat(result.getErrors().get(0)).startsWith("line 2:");
        assertThat(result.getParseErrors()).isEqualTo(1);
        assertThat(result.getChecksum()).hasSize(64);
        assertThat(result.getFileId()).isNotNull();
        assertThat(result.getTimeRange().getEarliestIso()).isEqualTo("2023-11-14T22:13:20Z");
        assertThat(result.getTimeRange().getLatestIso()).isEqualTo("2023-11-14T22:14:00Z");
        assertThat(result.getNote()).isEqualTo(UploadService.OUTSIDE_DEFAULT_WINDOW_NOTE);

        Upload stored = fixture.uploadRepository.findById(result.getFileId()).orElseThrow();
        assertThat(stored.getTotalRecords()).isEqualTo(2);
        assertThat(stored.getInsertedRecords()).isEqualTo(2);
        assertThat(fixture.eventRepository.countByFileId(result.getFileId())).isEqualTo(2);
    }

    @Test
    @DisplayName("Should report already_processed for a byte-identical re-upload")
    void shouldShortCircuitReupload() {
        UploadResult first = upload("events.ndjson", TWO_VALID_ONE_INVALID);

        UploadResult second = upload("renamed.ndjson", TWO_VALID_ONE_INVALID);

        assertThat(second.getStatus()).isEqualTo(UploadStatus.ALREADY_PROCESSED);
        assertThat(second.getInserted()).isEqualTo(2);
        assertThat(second.getTotal()).isEqualTo(2);
        assertThat(second.getFileId()).isEqualTo(first.getFileId());
        assertThat(second.getNote()).isEqualTo(UploadService.ALREADY_PROCESSED_NOTE);
        assertThat(fixture.eventRepository.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should reprocess a file whose first attempt inserted nothing")
    void shouldReprocessZeroInsertUpload() {
        // Given: every event of the second file is already stored by the first
        String original = ndjson("ray", 3, 1_700_000_000_000L);
        String duplicate = original + "\n";
        upload("a.ndjson", original);
        UploadResult firstAttempt = upload("b.ndjson", duplicate);
        assertThat(firstAttempt.getInserted()).isZero();
        assertThat(firstAttempt.getDeduped()).isEqualTo(3);

        // When
        UploadResult retry = upload("b.ndjson", duplicate);

        // Then
        assertThat(retry.getStatus()).isEqualTo(UploadStatus.SUCCESS);
        assertThat(retry.getDeduped()).isEqualTo(3);
        assertThat(retry.getFileId()).isNotEqualTo(firstAttempt.getFileId());
        assertThat(fixture.uploadRepository.findById(firstAttempt.getFileId())).isEmpty();
    }

    @Test
    @DisplayName("Should report no_valid_events and allow a later retry")
    void shouldReportNoValidEvents() {
        String content = "{\"foo\":1}\nnot json\n";

        UploadResult first = upload("junk.ndjson", content);
        UploadResult second = upload("junk.ndjson", content);

        assertThat(first.getStatus()).isEqualTo(UploadStatus.NO_VALID_EVENTS);
        assertThat(first.getErrors()).hasSize(1);
        assertThat(first.getParseErrors()).isEqualTo(1);
        assertThat(second.getStatus()).isEqualTo(UploadStatus.NO_VALID_EVENTS);
        assertThat(fixture.uploadRepository.findAll()).hasSize(1);
    }

    @Test
    @DisplayName("Should insert every event of a file twice the batch size")
    void shouldInsertAcrossBatchBoundary() {
        UploadResult result = upload("big.ndjson", ndjson("ray", BATCH_SIZE * 2, 1_700_000_000_000L));

        assertThat(result.getTotal()).isEqualTo(BATCH_SIZE * 2);
        assertThat(result.getInserted()).isEqualTo(BATCH_SIZE * 2);
        assertThat(result.getDeduped()).isZero();
        assertThat(fixture.eventRepository.count()).isEqualTo(BATCH_SIZE * 2);
    }

    @Test
    @DisplayName("Should dedup an event already stored by another file")
    void shouldDedupAcrossFiles() {
        upload("a.ndjson", ndjson("ray", 2, 1_700_000_000_000L));

        UploadResult result = upload("b.ndjson", ndjson("ray", 3, 1_700_000_000_000L));

        assertThat(result.getInserted()).isEqualTo(1);
        assertThat(result.getDeduped()).isEqualTo(2);
        assertThat(fixture.eventRepository.count()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should update rollups after a successful upload")
    void shouldApplyRollups() {
        upload("events.ndjson", TWO_VALID_ONE_INVALID);

        assertThat(fixture.rollupQueries.topRules(10))
            .extracting(TopRule::getRuleId)
            .containsExactlyInAnyOrder("managed_sqli", "custom_geo");
        assertThat(fixture.rollupQueries.topPaths(10)).hasSize(1);
        assertThat(fixture.rollupQueries.dailyActions("2023-11-14", "2023-11-14")).hasSize(2);
    }

    @Test
    @DisplayName("Should not add a note for recent events")
    void shouldOmitNoteForRecentEvents() {
        UploadResult result = upload("recent.ndjson", ndjson("ray", 2, System.currentTimeMillis() - 60_000));

        assertThat(result.getNote()).isNull();
    }

    @Test
    @DisplayName("Should reject an oversized file without storing it")
    void shouldRejectOversizedFile() {
        UploadService smallLimit = fixture.uploadService(null, 1);

        UploadResult result = smallLimit.processFile("huge.ndjson", "{}", 2L * 1024 * 1024);

        assertThat(result.getStatus()).isEqualTo(UploadStatus.ERROR);
        assertThat(result.getError()).contains("exceeds maximum");
        assertThat(fixture.uploadRepository.findAll()).isEmpty();
    }

    @Test
    @DisplayName("Should retain raw content under the checksum key")
    void shouldRetainRawContent() {
        InMemoryRawContentStore store = new InMemoryRawContentStore();
        UploadService retaining = fixture.uploadService(store, 50);

        UploadResult result = retaining.processFile("events.ndjson", TWO_VALID_ONE_INVALID, 10);

        String key = RawContentStore.keyFor(result.getChecksum());
        assertThat(store.get(key)).contains(TWO_VALID_ONE_INVALID);
        assertThat(fixture.uploadRepository.findById(result.getFileId()))
            .get()
            .extracting(Upload::getRawKey)
            .isEqualTo(key);
    }

    @Test
    @DisplayName("Should process every multipart file even when one is rejected")
    void shouldProcessFilesIndependently() {
        UploadService smallLimit = fixture.uploadService(null, 1);
        List<MultipartFile> files = List.of(
            new MockMultipartFile("files", "a.ndjson", "application/x-ndjson",
                ndjson("a", 2, 1_700_000_000_000L).getBytes(StandardCharsets.UTF_8)),
            new MockMultipartFile("files", "huge.ndjson", "application/x-ndjson", new byte[1024 * 1024 + 1]),
            new MockMultipartFile("files", "b.ndjson", "application/x-ndjson",
                ndjson("b", 3, 1_700_000_000_000L).getBytes(StandardCharsets.UTF_8)));

        List<UploadResult> results = smallLimit.processFiles(files);

        assertThat(results)
            .extracting(UploadResult::getFilename, UploadResult::getStatus, UploadResult::getInserted)
            .containsExactly(
                tuple("a.ndjson", UploadStatus.SUCCESS, 2L),
                tuple("huge.ndjson", UploadStatus.ERROR, 0L),
                tuple("b.ndjson", UploadStatus.SUCCESS, 3L));
    }

    @Test
    @DisplayName("Should report truthful counts when storage fails part-way")
    void shouldReportPartialStorageFailure() {
        // Given
        EventBatchWriter failingWriter = mock(EventBatchWriter.class);
        when(failingWriter.write(anyList(), anyLong(), any())).thenReturn(BatchWriteOutcome.failed(
            new BatchTally(1, 0, 1), 2, new DataAccessResourceFailureException("disk full")));
        FileIngestor ingestor = new FileIngestor(
            new ContentParser(new ObjectMapper(), new WafRecordNormalizer()),
            failingWriter, fixture.uploadRepository, fixture.metrics);
        UploadService service = new UploadService(new ChecksumCalculator(), fixture.uploadRepository,
            fixture.eventRepository, ingestor, fixture.rollupUpdater, Optional.empty(), fixture.metrics, 50);

        // When
        UploadResult result = service.processFile("events.ndjson", TWO_VALID_ONE_INVALID, 10);

        // Then
        assertThat(result.getStatus()).isEqualTo(UploadStatus.ERROR);
        assertThat(result.getTotal()).isEqualTo(2);
        assertThat(result.getInserted()).isEqualTo(1);
        assertThat(result.getError()).contains("after 1 of 2 events", "disk full");
        assertThat(fixture.meterRegistry.counter("bastion.ingestion.files", "status", "error").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should store and roll up events with nanosecond timestamps")
    void shouldIngestNanosecondTimestamps() {
        // Given
        String content = """
            {"RayID":"ns-1","EdgeStartTimestamp":1700000000000000000,"ClientIP":"192.0.2.9","action":"block"}
            {"RayID":"ms-1","EdgeStartTimestamp":1700000000001,"ClientIP":"192.0.2.9","action":"block"}
            """;

        // When
        UploadResult first = upload("logpush.ndjson", content);
        UploadResult second = upload("logpush.ndjson", content);

        // Then
        assertThat(first.getStatus()).isEqualTo(UploadStatus.SUCCESS);
        assertThat(first.getInserted()).isEqualTo(2);
        assertThat(first.getTimeRange().getEarliestIso()).isEqualTo("2023-11-14T22:13:20Z");
        assertThat(second.getStatus()).isEqualTo(UploadStatus.ALREADY_PROCESSED);
        assertThat(fixture.rollupQueries.topIps(10)).singleElement()
            .satisfies(ip -> assertThat(ip.getCount()).isEqualTo(2));
        assertThat(fixture.rollupQueries.dailyActions("2023-11-14", "2023-11-14"))
            .singleElement()
            .satisfies(day -> assertThat(day.getCount()).isEqualTo(2));
    }

    @Test
    @DisplayName("Should report stored counts when the rollup update fails")
    void shouldReportCountsWhenRollupFails() {
        // Given
        RollupUpdater failingRollups = mock(RollupUpdater.class);
        doThrow(new DataAccessResourceFailureException("database is locked"))
            .when(failingRollups).applyUpload(anyLong());
        UploadService service = new UploadService(new ChecksumCalculator(), fixture.uploadRepository,
            fixture.eventRepository, fixture.fileIngestor, failingRollups, Optional.empty(), fixture.metrics, 50);

        // When
        UploadResult result = service.processFile("events.ndjson", TWO_VALID_ONE_INVALID, 10);

        // Then
        assertThat(result.getStatus()).isEqualTo(UploadStatus.ERROR);
        assertThat(result.getFileId()).isNotNull();
        assertThat(result.getTotal()).isEqualTo(2);
        assertThat(result.getInserted()).isEqualTo(2);
        assertThat(result.getError()).contains("Stored 2 events", "database is locked", "rollup rebuild");
        assertThat(fixture.eventRepository.countByFileId(result.getFileId())).isEqualTo(2);
    }

    @Test
    @DisplayName("Should report the recorded counters when processing fails after the write")
    void shouldReportRecordedCountersOnLateFailure() {
        // Given
        FileIngestor ingestor = spy(fixture.fileIngestor);
        doAnswer(invocation -> {
            invocation.callRealMethod();
            throw new DataAccessResourceFailureException("database is locked");
        }).when(ingestor).ingest(anyLong(), anyString());
        UploadService service = new UploadService(new ChecksumCalculator(), fixture.uploadRepository,
            fixture.eventRepository, ingestor, fixture.rollupUpdater, Optional.empty(), fixture.metrics, 50);

        // When
        UploadResult result = service.processFile("events.ndjson", TWO_VALID_ONE_INVALID, 10);

        // Then
        assertThat(result.getStatus()).isEqualTo(UploadStatus.ERROR);
        assertThat(result.getError()).isEqualTo("database is locked");
        assertThat(result.getFileId()).isNotNull();
        assertThat(result.getTotal()).isEqualTo(2);
        assertThat(result.getInserted()).isEqualTo(2);
        assertThat(result.getDeduped()).isZero();
    }
}
