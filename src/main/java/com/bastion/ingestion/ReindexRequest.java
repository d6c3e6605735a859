package com.bastion.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Identifies the upload to reindex, by checksum or by file id
 */
public class ReindexRequest {

    @JsonProperty("checksum")
    private String checksum;

    @JsonProperty("file_id")
    private Long fileId;

    public ReindexRequest() {
    }

    public ReindexRequest(String checksum, Long fileId) {
        this.checksum = checksum;
        this.fileId = fileId;
    }

    public static ReindexRequest byChecksum(String checksum) {
        return new ReindexRequest(checksum, null);
    }

    public static ReindexRequest byFileId(long fileId) {
        return new ReindexRequest(null, fileId);
    }

    public String getChecksum() {
        return checksum;
    }

    public void setChecksum(String checksum) {
        this.checksum = checksum;
    }

    public Long getFileId() {
        return fileId;
    }

    public void setFileId(Long fileId) {
        this.fileId = fileId;
    }

    public boolean hasChecksum() {
        return checksum != null && !checksum.isBlank();
    }

    public boolean hasFileId() {
        return fileId != null;
    }

    @Override
    public String toString() {
        return "ReindexRequest{checksum=" + checksum + ", fileId=" + fileId + "}";
    }
}
