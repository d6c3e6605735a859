package com.bastion.normalization;

/**
 * Exception thrown when a single record of an export cannot be decoded.
 * Carries the 1-based position of the record so the failure can be reported
 * back to the uploader without aborting the rest of the file.
 */
public class ParseException extends RuntimeException {

    private final String location;

    public ParseException(String message, String location) {
        super(message);
        this.location = location;
    }

    public ParseException(String message, String location, Throwable cause) {
        super(message, cause);
        this.location = location;
    }

    /**
     * Where the record sits in the file, e.g. "line 3" or "record 12"
     */
    public String getLocation() {
        return location;
    }

    /**
     * Human-readable error line as shown to the uploader
     */
    public String describe() {
        return location + ": " + getMessage();
    }
}
