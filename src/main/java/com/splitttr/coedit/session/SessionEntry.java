package com.splitttr.coedit.session;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Directory slot for one document. Put into the directory before the content is
 * loaded, so the load runs outside any map operation while later joiners of the same
 * document wait on this slot only.
 */
final class SessionEntry {

    private final CompletableFuture<DocumentSession> opened = new CompletableFuture<>();
    private final CompletableFuture<Void> removed = new CompletableFuture<>();

    void opened(DocumentSession session) {
        opened.complete(session);
    }

    void failed(RuntimeException cause) {
        opened.completeExceptionally(cause);
    }

    /**
     * Blocks until the opener finished loading. A failed load is rethrown to every
     * waiter.
     */
    DocumentSession awaitOpen() {
        try {
            return opened.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    /**
     * @return the session, or null while still loading or after a failed load
     */
    DocumentSession sessionOrNull() {
        if (!opened.isDone() || opened.isCompletedExceptionally()) {
            return null;
        }
        return opened.join();
    }

    boolean holds(DocumentSession session) {
        return sessionOrNull() == session;
    }

    /** Signals that the retired session has been saved and left the directory. */
    void markRemoved() {
        removed.complete(null);
    }

    void awaitRemoved() {
        removed.join();
    }
}
