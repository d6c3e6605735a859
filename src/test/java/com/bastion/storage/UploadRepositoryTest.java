package com.bastion.storage;

import com.bastion.domain.TestEvents;
import com.bastion.domain.Upload;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataAccessException;

import java.nio.file.Path;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for UploadRepository against a real SQLite store.
 */
@DisplayName("UploadRepository Tests")
class UploadRepositoryTest {

    @TempDir
    Path tempDir;

    private TestDatabase database;
    private UploadRepository uploadRepository;

    @BeforeEach
    void setUp() {
        database = TestDatabase.create(tempDir);
        uploadRepository = new UploadRepository(database.jdbcTemplate());
    }

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    @DisplayName("Should create an upload and find it by checksum and id")
    void shouldCreateAndFind() {
        // Given
        Upload created = uploadRepository.create(new Upload("events.json", "abc123", 2048, 1_000L));

        // When
        Optional<Upload> byChecksum = uploadRepository.findByChecksum("abc123");
        Optional<Upload> byId = uploadRepository.findById(created.getId());

        // Then
        assertThat(created.getId()).isPositive();
        assertThat(byChecksum).isPresent();
        assertThat(byChecksum.get().getFilename()).isEqualTo("events.json");
        assertThat(byChecksum.get().getSize()).isEqualTo(2048);
        assertThat(byId).get().extracting(Upload::getChecksum).isEqualTo("abc123");
        assertThat(byId.get().isRetryable()).isTrue();
    }

    @Test
    @DisplayName("Should reject a second upload with the same checksum")
    void shouldEnforceUniqueChecksum() {
        uploadRepository.create(new Upload("a.json", "same", 1, 1L));

        assertThatThrownBy(() -> uploadRepository.create(new Upload("b.json", "same", 1, 2L)))
            .isInstanceOf(DataAccessException.class);
    }

    @Test
    @DisplayName("Should overwrite counters and raw key")
    void shouldUpdateCountersAndRawKey() {
        long id = uploadRepository.create(new Upload("a.json", "c1", 1, 1L)).getId();

        uploadRepository.updateCounters(id, 10, 7, 3);
        uploadRepository.updateRawKey(id, "uploads/c1");

        Upload stored = uploadRepository.findById(id).orElseThrow();
        assertThat(stored.getTotalRecords()).isEqualTo(10);
        assertThat(stored.getInsertedRecords()).isEqualTo(7);
        assertThat(stored.getDedupedRecords()).isEqualTo(3);
        assertThat(stored.getRawKey()).isEqualTo("uploads/c1");
        assertThat(stored.isRetryable()).isFalse();
    }

    @Test
    @DisplayName("Should delete an upload together with its events")
    void shouldCascadeDeleteToEvents() {
        // Given
        long id = uploadRepository.create(new Upload("a.json", "c1", 1, 1L)).getId();
        EventRepository events = new EventRepository(database.jdbcTemplate());
        events.insertOrIgnore(TestEvents.sequence("ray", 3), id, 1L);

        // When
        boolean deleted = uploadRepository.deleteById(id);

        // Then
        assertThat(deleted).isTrue();
        assertThat(events.count()).isZero();
        assertThat(uploadRepository.deleteById(id)).isFalse();
    }

    @Test
    @DisplayName("Should list uploads most recent first")
    void shouldListMostRecentFirst() {
        uploadRepository.create(new Upload("old.json", "c1", 1, 1_000L));
        uploadRepository.create(new Upload("new.json", "c2", 1, 2_000L));

        assertThat(uploadRepository.findAll())
            .extracting(Upload::getFilename)
            .containsExactly("new.json", "old.json");
    }

    @Test
    @DisplayName("Should reject an empty checksum lookup")
    void shouldRejectEmptyChecksum() {
        assertThatThrownBy(() -> uploadRepository.findByChecksum(""))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
