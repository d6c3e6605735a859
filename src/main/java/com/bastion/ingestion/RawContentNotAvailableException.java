package com.bastion.ingestion;

/**
 * Raised when an upload's raw content cannot be fetched for reindexing
 */
public class RawContentNotAvailableException extends RuntimeException {

    public enum Reason {
        /**
         * Raw retention is switched off for this deployment
         */
        RETENTION_DISABLED,

        /**
         * The upload was stored without a raw content key
         */
        NOT_RETAINED,

        /**
         * The upload has a raw key but the blob store has nothing under it
         */
        MISSING
    }

    private final long fileId;
    private final Reason reason;

    public RawContentNotAvailableException(long fileId, Reason reason, String message) {
        super(message);
        this.fileId = fileId;
        this.reason = reason;
    }

    public long getFileId() {
        return fileId;
    }

    public Reason getReason() {
        return reason;
    }
}
