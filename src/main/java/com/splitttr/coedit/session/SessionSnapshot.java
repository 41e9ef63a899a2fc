package com.splitttr.coedit.session;

import com.splitttr.coedit.message.CursorPosition;
import com.splitttr.coedit.message.ServerMessage;
import com.splitttr.coedit.message.TextSelection;

import java.util.List;

public record SessionSnapshot(
    String sessionId,
    String documentPath,
    String content,
    long version,
    List<String> participants,
    List<CursorPosition> cursors,
    List<TextSelection> selections
) {
    public ServerMessage toMessage() {
        return ServerMessage.snapshot(sessionId, documentPath, content, version, participants, cursors, selections);
    }
}
