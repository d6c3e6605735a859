package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One ingested file.
 *
 * An upload row is created once per distinct content checksum, before any
 * event is written, so an interrupted ingestion still leaves a trail. The three
 * record counters are rewritten after every chunk of events completes.
 */
public class Upload {

    @JsonProperty("id")
    private long id;

    @JsonProperty("filename")
    private String filename;

    /**
     * SHA-256 hex digest of the file content, unique across uploads
     */
    @JsonProperty("checksum")
    private String checksum;

    @JsonProperty("size")
    private long size;

    /**
     * Upload time in epoch milliseconds
     */
    @JsonProperty("uploaded_at")
    private long uploadedAt;

    /**
     * Blob-store key of the retained raw content, null when retention was off
     */
    @JsonProperty("raw_key")
    private String rawKey;

    @JsonProperty("total_records")
    private long totalRecords;

    @JsonProperty("inserted_records")
    private long insertedRecords;

    @JsonProperty("deduped_records")
    private long dedupedRecords;

    public Upload() {
    }

    public Upload(String filename, String checksum, long size, long uploadedAt) {
        this.filename = filename;
        this.checksum = checksum;
        this.size = size;
        this.uploadedAt = uploadedAt;
    }

    public long getId() {
        return id;
    }

    public void setId(long id) {
        this.id = id;
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public String getChecksum() {
        return checksum;
    }

    public void setChecksum(String checksum) {
        this.checksum = checksum;
    }

    public long getSize() {
        return size;
    }

    public void setSize(long size) {
        this.size = size;
    }

    public long getUploadedAt() {
        return uploadedAt;
    }

    public void setUploadedAt(long uploadedAt) {
        this.uploadedAt = uploadedAt;
    }

    public String getRawKey() {
        return rawKey;
    }

    public void setRawKey(String rawKey) {
        this.rawKey = rawKey;
    }

    public long getTotalRecords() {
        return totalRecords;
    }

    public void setTotalRecords(long totalRecords) {
        this.totalRecords = totalRecords;
    }

    public long getInsertedRecords() {
        return insertedRecords;
    }

    public void setInsertedRecords(long insertedRecords) {
        this.insertedRecords = insertedRecords;
    }

    public long getDedupedRecords() {
        return dedupedRecords;
    }

    public void setDedupedRecords(long dedupedRecords) {
        this.dedupedRecords = dedupedRecords;
    }

    /**
     * A previous attempt that inserted nothing is treated as failed and may be retried.
     *
     * @return true if no event row was ever inserted for this upload
     */
    @JsonIgnore
    public boolean isRetryable() {
        return insertedRecords == 0;
    }

    @Override
    public String toString() {
        return "Upload{" +
                "id=" + id +
                ", filename='" + filename + '\'' +
                ", checksum='" + checksum + '\'' +
                ", inserted=" + insertedRecords +
                ", deduped=" + dedupedRecords +
                '}';
    }
}
