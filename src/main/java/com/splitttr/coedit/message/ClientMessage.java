package com.splitttr.coedit.message;

import java.time.Instant;
import java.util.List;

public record ClientMessage(
    String type,            // "join", "leave", "mutation", "cursor", "selection", "batch", "snapshot"
    String documentPath,
    MutationKind kind,
    Integer position,
    String insertedText,
    String deletedText,
    Instant timestamp,
    Integer line,
    Integer column,
    Integer startLine,
    Integer startColumn,
    Integer endLine,
    Integer endColumn,
    List<ClientMessage> mutations
) {
    /**
     * Builds a mutation owned by the authenticated user. The timestamp stays null
     * when the client did not send one; the session stamps it on receipt.
     */
    public Mutation toMutation(String userId, String sessionId) {
        if (kind == null || position == null) {
            throw new IllegalArgumentException("Mutation requires kind and position");
        }
        return new Mutation(userId, sessionId, kind, position, insertedText, deletedText, timestamp);
    }

    public List<Mutation> toMutations(String userId, String sessionId) {
        if (mutations == null || mutations.isEmpty()) {
            throw new IllegalArgumentException("Batch requires at least one mutation");
        }
        return mutations.stream()
            .map(m -> m.toMutation(userId, sessionId))
            .toList();
    }

    public boolean hasCursor() {
        return line != null && column != null;
    }

    public boolean hasSelection() {
        return startLine != null && startColumn != null && endLine != null && endColumn != null;
    }
}
