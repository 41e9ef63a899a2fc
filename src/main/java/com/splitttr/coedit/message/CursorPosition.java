package com.splitttr.coedit.message;

import java.time.Instant;

public record CursorPosition(String userId, int line, int column, Instant lastUpdated) {

    public boolean samePlace(int line, int column) {
        return this.line == line && this.column == column;
    }
}
