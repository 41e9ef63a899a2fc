package com.splitttr.coedit.message;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * One atomic text edit. {@code position} is a UTF-16 character offset into the
 * content at apply time; {@code deletedText} is the text the author expects to
 * find there for deletes and replaces.
 */
public record Mutation(
    String userId,
    String sessionId,
    MutationKind kind,
    int position,
    String insertedText,
    String deletedText,
    Instant timestamp
) {
    public Mutation {
        insertedText = insertedText == null ? "" : insertedText;
        deletedText = deletedText == null ? "" : deletedText;
    }

    public static Mutation insert(String userId, String sessionId, int position, String text, Instant timestamp) {
        return new Mutation(userId, sessionId, MutationKind.INSERT, position, text, "", timestamp);
    }

    public static Mutation delete(String userId, String sessionId, int position, String deletedText, Instant timestamp) {
        return new Mutation(userId, sessionId, MutationKind.DELETE, position, "", deletedText, timestamp);
    }

    public static Mutation replace(String userId, String sessionId, int position, String deletedText,
                                   String insertedText, Instant timestamp) {
        return new Mutation(userId, sessionId, MutationKind.REPLACE, position, insertedText, deletedText, timestamp);
    }

    /**
     * Ties this mutation to {@code sessionId}, stamping it with {@code receivedAt}
     * when the client sent no timestamp of its own.
     */
    public Mutation bind(String sessionId, Instant receivedAt) {
        return new Mutation(userId, sessionId, kind, position, insertedText, deletedText,
            timestamp == null ? receivedAt : timestamp);
    }

    /**
     * Splices this edit into {@code content}. Callers check the precondition first;
     * no validation happens here.
     */
    public String applyTo(String content) {
        int end = position + deletedText.length();
        return switch (kind) {
            case INSERT -> content.substring(0, position) + insertedText + content.substring(position);
            case DELETE -> content.substring(0, position) + content.substring(end);
            case REPLACE -> content.substring(0, position) + insertedText + content.substring(end);
        };
    }

    @JsonIgnore
    public int deletedLength() {
        return deletedText.length();
    }
}
