package com.splitttr.coedit.message;

import java.time.Instant;

public record TextSelection(
    String userId,
    int startLine,
    int startColumn,
    int endLine,
    int endColumn,
    Instant lastUpdated
) {
    public boolean sameRange(int startLine, int startColumn, int endLine, int endColumn) {
        return this.startLine == startLine && this.startColumn == startColumn
            && this.endLine == endLine && this.endColumn == endColumn;
    }
}
