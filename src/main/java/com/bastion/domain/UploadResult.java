package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * Per-file statistics returned to the caller of an upload or reindex.
 *
 * The caller always gets one of these per file, including for rejected files
 * and partial storage failures; counters then reflect what was actually committed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UploadResult {

    /**
     * Maximum number of per-record error strings echoed back
     */
    public static final int MAX_REPORTED_ERRORS = 10;

    @JsonProperty("filename")
    private final String filename;

    @JsonProperty("checksum")
    private final String checksum;

    @JsonProperty("file_id")
    private final Long fileId;

    @JsonProperty("status")
    private final UploadStatus status;

    @JsonProperty("total")
    private final long total;

    @JsonProperty("inserted")
    private final long inserted;

    @JsonProperty("deduped")
    private final long deduped;

    @JsonProperty("errors")
    private final List<String> errors;

    /**
     * Full number of per-record errors, before capping
     */
    @JsonProperty("parse_errors")
    private final int parseErrors;

    @JsonProperty("time_range")
    private final TimeRange timeRange;

    @JsonProperty("note")
    private final String note;

    @JsonProperty("error")
    private final String error;

    private UploadResult(Builder builder) {
        this.filename = builder.filename;
        this.checksum = builder.checksum;
        this.fileId = builder.fileId;
        this.status = builder.status;
        this.total = builder.total;
        this.inserted = builder.inserted;
        this.deduped = builder.deduped;
        List<String> allErrors = builder.errors != null ? builder.errors : Collections.emptyList();
        this.parseErrors = allErrors.size();
        this.errors = Collections.unmodifiableList(
            allErrors.subList(0, Math.min(allErrors.size(), MAX_REPORTED_ERRORS)));
        this.timeRange = builder.timeRange;
        this.note = builder.note;
        this.error = builder.error;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Result for a file rejected before any processing took place.
     *
     * @param filename name of the rejected file
     * @param message reason for rejection
     * @return error result with zero counters
     */
    public static UploadResult rejected(String filename, String message) {
        return builder()
            .filename(filename)
            .status(UploadStatus.ERROR)
            .error(message)
            .build();
    }

    public static class Builder {
        private String filename;
        private String checksum;
        private Long fileId;
        private UploadStatus status;
        private long total;
        private long inserted;
        private long deduped;
        private List<String> errors;
        private TimeRange timeRange;
        private String note;
        private String error;

        public Builder filename(String filename) {
            this.filename = filename;
            return this;
        }

        public Builder checksum(String checksum) {
            this.checksum = checksum;
            return this;
        }

        public Builder fileId(Long fileId) {
            this.fileId = fileId;
            return this;
        }

        public Builder status(UploadStatus status) {
            this.status = status;
            return this;
        }

        public Builder total(long total) {
            this.total = total;
            return this;
        }

        public Builder inserted(long inserted) {
            this.inserted = inserted;
            return this;
        }

        public Builder deduped(long deduped) {
            this.deduped = deduped;
            return this;
        }

        public Builder errors(List<String> errors) {
            this.errors = errors;
            return this;
        }

        public Builder timeRange(TimeRange timeRange) {
            this.timeRange = timeRange;
            return this;
        }

        public Builder note(String note) {
            this.note = note;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public UploadResult build() {
            return new UploadResult(this);
        }
    }

    public String getFilename() {
        return filename;
    }

    public String getChecksum() {
        return checksum;
    }

    public Long getFileId() {
        return fileId;
    }

    public UploadStatus getStatus() {
        return status;
    }

    public long getTotal() {
        return total;
    }

    public long getInserted() {
        return inserted;
    }

    public long getDeduped() {
        return deduped;
    }

    public List<String> getErrors() {
        return errors;
    }

    public int getParseErrors() {
        return parseErrors;
    }

    public TimeRange getTimeRange() {
        return timeRange;
    }

    public String getNote() {
        return note;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return String.format("UploadResult{filename='%s', status=%s, total=%d, inserted=%d, deduped=%d}",
            filename, status, total, inserted, deduped);
    }
}
