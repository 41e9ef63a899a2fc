package com.splitttr.coedit.session;

import com.splitttr.coedit.channel.Outbox;
import com.splitttr.coedit.channel.ParticipantChannel;
import com.splitttr.coedit.message.CursorPosition;
import com.splitttr.coedit.message.TextSelection;

import java.time.Instant;

/**
 * One user's presence inside a session. Cursor and selection are null until the
 * user first reports them.
 */
public record Participant(
    String userId,
    Outbox outbox,
    CursorPosition cursor,
    TextSelection selection,
    Instant joinedAt
) {
    public Participant(String userId, ParticipantChannel channel, Instant joinedAt) {
        this(userId, new Outbox(channel), null, null, joinedAt);
    }

    public ParticipantChannel channel() {
        return outbox.channel();
    }

    Participant withCursor(CursorPosition cursor) {
        return new Participant(userId, outbox, cursor, selection, joinedAt);
    }

    Participant withSelection(TextSelection selection) {
        return new Participant(userId, outbox, cursor, selection, joinedAt);
    }
}
