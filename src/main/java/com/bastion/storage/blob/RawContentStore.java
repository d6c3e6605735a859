package com.bastion.storage.blob;

import java.util.Optional;

/**
 * Blob store holding the raw text of uploaded files, for later reindexing
 */
public interface RawContentStore {

    /**
     * Store key for an upload's raw content
     */
    static String keyFor(String checksum) {
        return "uploads/" + checksum;
    }

    /**
     * Store raw content under a key, replacing any previous content
     *
     * @throws RawContentStoreException if the store rejects the write
     */
    void put(String key, String content);

    /**
     * Fetch raw content, empty if nothing is stored under the key
     *
     * @throws RawContentStoreException if the store cannot be read
     */
    Optional<String> get(String key);
}
