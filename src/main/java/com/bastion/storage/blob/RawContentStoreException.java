package com.bastion.storage.blob;

/**
 * Raised when the raw content blob store fails
 */
public class RawContentStoreException extends RuntimeException {

    private final String key;

    public RawContentStoreException(String message, String key, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
