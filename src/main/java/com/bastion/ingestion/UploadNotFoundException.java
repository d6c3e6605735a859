package com.bastion.ingestion;

/**
 * Raised when a reindex names an upload that does not exist
 */
public class UploadNotFoundException extends RuntimeException {

    private final String reference;

    public UploadNotFoundException(String reference) {
        super("Upload not found: " + reference);
        this.reference = reference;
    }

    /**
     * The checksum or file id that was looked up
     */
    public String getReference() {
        return reference;
    }
}
