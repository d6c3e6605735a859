package com.bastion.storage;

import com.bastion.domain.Upload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Repository for upload records.
 *
 * An upload is looked up by its content checksum to short-circuit re-ingestion
 * of identical files, and by id for reindexing.
 */
@Repository
public class UploadRepository {

    private static final Logger log = LoggerFactory.getLogger(UploadRepository.class);

    private static final String SELECT_COLUMNS = """
        SELECT id, filename, checksum, size, uploaded_at, raw_key,
               total_records, inserted_records, deduped_records
        FROM uploads
        """;

    private static final RowMapper<Upload> UPLOAD_ROW_MAPPER = new UploadRowMapper();

    private final JdbcTemplate jdbcTemplate;

    public UploadRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Insert a new upload and assign its generated id.
     *
     * @param upload the upload to create; counters start at zero
     * @return the same upload with its id set
     * @throws IllegalArgumentException if the upload or its checksum is missing
     */
    public Upload create(Upload upload) {
        if (upload == null) {
            throw new IllegalArgumentException("Upload must not be null");
        }
        if (upload.getChecksum() == null || upload.getChecksum().isEmpty()) {
            throw new IllegalArgumentException("Upload checksum must not be null or empty");
        }

        jdbcTemplate.update(
            "INSERT INTO uploads (filename, checksum, size, uploaded_at, raw_key) VALUES (?, ?, ?, ?, ?)",
            upload.getFilename(), upload.getChecksum(), upload.getSize(), upload.getUploadedAt(), upload.getRawKey());

        // checksum is unique, so it identifies the row just written
        Long id = jdbcTemplate.queryForObject(
            "SELECT id FROM uploads WHERE checksum = ?", Long.class, upload.getChecksum());
        upload.setId(id);

        log.info("Created upload: id={}, filename={}, checksum={}", id, upload.getFilename(), upload.getChecksum());
        return upload;
    }

    public Optional<Upload> findById(long id) {
        List<Upload> uploads = jdbcTemplate.query(SELECT_COLUMNS + " WHERE id = ?", UPLOAD_ROW_MAPPER, id);
        return uploads.stream().findFirst();
    }

    /**
     * @throws IllegalArgumentException if checksum is null or empty
     */
    public Optional<Upload> findByChecksum(String checksum) {
        if (checksum == null || checksum.isEmpty()) {
            throw new IllegalArgumentException("Checksum must not be null or empty");
        }
        List<Upload> uploads = jdbcTemplate.query(SELECT_COLUMNS + " WHERE checksum = ?", UPLOAD_ROW_MAPPER, checksum);
        return uploads.stream().findFirst();
    }

    /**
     * All uploads, most recent first
     */
    public List<Upload> findAll() {
        return jdbcTemplate.query(SELECT_COLUMNS + " ORDER BY uploaded_at DESC, id DESC", UPLOAD_ROW_MAPPER);
    }

    /**
     * Overwrite the record counters of an upload.
     */
    public void updateCounters(long id, long total, long inserted, long deduped) {
        jdbcTemplate.update(
            "UPDATE uploads SET total_records = ?, inserted_records = ?, deduped_records = ? WHERE id = ?",
            total, inserted, deduped, id);
        log.debug("Updated upload {} counters: total={}, inserted={}, deduped={}", id, total, inserted, deduped);
    }

    public void updateRawKey(long id, String rawKey) {
        jdbcTemplate.update("UPDATE uploads SET raw_key = ? WHERE id = ?", rawKey, id);
    }

    /**
     * Delete an upload. Events owned by it are removed through the cascading foreign key.
     *
     * @return true if a row was deleted
     */
    public boolean deleteById(long id) {
        int deleted = jdbcTemplate.update("DELETE FROM uploads WHERE id = ?", id);
        if (deleted > 0) {
            log.info("Deleted upload: {}", id);
        }
        return deleted > 0;
    }

    private static class UploadRowMapper implements RowMapper<Upload> {
        @Override
        public Upload mapRow(ResultSet rs, int rowNum) throws SQLException {
            Upload upload = new Upload();
            upload.setId(rs.getLong("id"));
            upload.setFilename(rs.getString("filename"));
            upload.setChecksum(rs.getString("checksum"));
            upload.setSize(rs.getLong("size"));
            upload.setUploadedAt(rs.getLong("uploaded_at"));
            upload.setRawKey(rs.getString("raw_key"));
            upload.setTotalRecords(rs.getLong("total_records"));
            upload.setInsertedRecords(rs.getLong("inserted_records"));
            upload.setDedupedRecords(rs.getLong("deduped_records"));
            return upload;
        }
    }
}
