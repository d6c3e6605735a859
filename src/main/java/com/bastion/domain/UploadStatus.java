package com.bastion.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of processing a single uploaded or reindexed file.
 */
public enum UploadStatus {

    /**
     * All chunks were written.
     */
    SUCCESS("success"),

    /**
     * Identical content was already ingested with at least one inserted row.
     */
    ALREADY_PROCESSED("already_processed"),

    /**
     * The content produced no canonical events.
     */
    NO_VALID_EVENTS("no_valid_events"),

    /**
     * The file was rejected or a storage failure cut processing short.
     * Counters reflect whatever was committed before the failure.
     */
    ERROR("error");

    private final String value;

    UploadStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
