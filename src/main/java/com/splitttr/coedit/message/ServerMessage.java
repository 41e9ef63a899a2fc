package com.splitttr.coedit.message;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerMessage(
    String type,
    String sessionId,
    String documentPath,
    String userId,
    String content,
    Long version,
    Mutation mutation,
    String reason,
    CursorPosition cursor,
    TextSelection selection,
    List<String> participants,
    List<CursorPosition> cursors,
    List<TextSelection> selections,
    Boolean resolved,
    List<Mutation> applied,
    List<Mutation> rejected,
    Instant timestamp,
    String error
) {

    public static ServerMessage snapshot(String sessionId, String documentPath, String content, long version,
                                         List<String> participants, List<CursorPosition> cursors,
                                         List<TextSelection> selections) {
        return new ServerMessage("snapshot", sessionId, documentPath, null, content, version, null, null,
            null, null, participants, cursors, selections, null, null, null, null, null);
    }

    public static ServerMessage mutation(String sessionId, Mutation mutation, long version) {
        return new ServerMessage("mutation", sessionId, null, mutation.userId(), null, version, mutation, null,
            null, null, null, null, null, null, null, null, mutation.timestamp(), null);
    }

    public static ServerMessage rejected(String sessionId, Mutation mutation, String reason) {
        return new ServerMessage("rejected", sessionId, null, mutation.userId(), null, null, mutation, reason,
            null, null, null, null, null, null, null, null, mutation.timestamp(), null);
    }

    public static ServerMessage cursor(String sessionId, CursorPosition cursor) {
        return new ServerMessage("cursor", sessionId, null, cursor.userId(), null, null, null, null,
            cursor, null, null, null, null, null, null, null, cursor.lastUpdated(), null);
    }

    public static ServerMessage selection(String sessionId, TextSelection selection) {
        return new ServerMessage("selection", sessionId, null, selection.userId(), null, null, null, null,
            null, selection, null, null, null, null, null, null, selection.lastUpdated(), null);
    }

    public static ServerMessage participantJoined(String sessionId, String userId, List<String> participants,
                                                  Instant at) {
        return new ServerMessage("participant_joined", sessionId, null, userId, null, null, null, null,
            null, null, participants, null, null, null, null, null, at, null);
    }

    public static ServerMessage participantLeft(String sessionId, String userId, Instant at) {
        return new ServerMessage("participant_left", sessionId, null, userId, null, null, null, null,
            null, null, null, null, null, null, null, null, at, null);
    }

    public static ServerMessage resolution(String sessionId, boolean resolved, String content, long version,
                                           List<Mutation> applied, List<Mutation> rejected) {
        return new ServerMessage("resolution", sessionId, null, null, content, version, null, null,
            null, null, null, null, null, resolved, applied, rejected, null, null);
    }

    public static ServerMessage error(String message) {
        return new ServerMessage("error", null, null, null, null, null, null, null,
            null, null, null, null, null, null, null, null, null, message);
    }
}
