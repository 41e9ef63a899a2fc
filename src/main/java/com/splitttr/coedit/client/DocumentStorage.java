package com.splitttr.coedit.client;

/**
 * Persistent home of document content. Both calls may fail with
 * {@link StorageUnavailableException}.
 */
public interface DocumentStorage {

    String loadContent(String documentPath);

    void persistContent(String documentPath, String content, String userId);
}
