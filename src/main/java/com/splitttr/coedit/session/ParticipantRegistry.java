package com.splitttr.coedit.session;

import com.splitttr.coedit.channel.ParticipantChannel;
import com.splitttr.coedit.message.CursorPosition;
import com.splitttr.coedit.message.TextSelection;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * userId to {@link Participant}, in join order. No locking of its own: always
 * accessed under the owning session's lock.
 */
class ParticipantRegistry {

    private final Map<String, Participant> participants = new LinkedHashMap<>();

    /**
     * Registers {@code userId}, replacing any earlier entry (a rejoin from a new
     * connection).
     *
     * @return the replaced participant, or null
     */
    Participant add(String userId, ParticipantChannel channel, Instant now) {
        return participants.put(userId, new Participant(userId, channel, now));
    }

    Participant remove(String userId) {
        return participants.remove(userId);
    }

    /**
     * Removes {@code userId} only while it is still attached through {@code channel}.
     * A user that already reconnected on a different channel is left alone.
     */
    boolean removeIfChannel(String userId, ParticipantChannel channel) {
        Participant current = participants.get(userId);
        if (current == null || current.channel() != channel) {
            return false;
        }
        participants.remove(userId);
        return true;
    }

    Participant get(String userId) {
        return participants.get(userId);
    }

    boolean contains(String userId) {
        return participants.containsKey(userId);
    }

    PresenceUpdate updateCursor(String userId, int line, int column, Instant now) {
        Participant existing = participants.get(userId);
        if (existing == null) return PresenceUpdate.UNKNOWN_PARTICIPANT;
        if (existing.cursor() != null && existing.cursor().samePlace(line, column)) {
            return PresenceUpdate.UNCHANGED;
        }
        participants.put(userId, existing.withCursor(new CursorPosition(userId, line, column, now)));
        return PresenceUpdate.CHANGED;
    }

    PresenceUpdate updateSelection(String userId, int startLine, int startColumn, int endLine, int endColumn,
                                   Instant now) {
        Participant existing = participants.get(userId);
        if (existing == null) return PresenceUpdate.UNKNOWN_PARTICIPANT;
        TextSelection current = existing.selection();
        if (current != null && current.sameRange(startLine, startColumn, endLine, endColumn)) {
            return PresenceUpdate.UNCHANGED;
        }
        participants.put(userId, existing.withSelection(
            new TextSelection(userId, startLine, startColumn, endLine, endColumn, now)));
        return PresenceUpdate.CHANGED;
    }

    void clear() {
        participants.clear();
    }

    boolean isEmpty() {
        return participants.isEmpty();
    }

    int size() {
        return participants.size();
    }

    List<String> userIds() {
        return List.copyOf(participants.keySet());
    }

    List<Participant> all() {
        return new ArrayList<>(participants.values());
    }

    List<Participant> allExcept(String excludeUserId) {
        return participants.values().stream()
            .filter(p -> !Objects.equals(p.userId(), excludeUserId))
            .toList();
    }

    List<CursorPosition> cursors() {
        return participants.values().stream()
            .map(Participant::cursor)
            .filter(Objects::nonNull)
            .toList();
    }

    List<TextSelection> selections() {
        return participants.values().stream()
            .map(Participant::selection)
            .filter(Objects::nonNull)
            .toList();
    }
}
