package com.splitttr.coedit.session;

/**
 * CREATED until the first participant attaches, ACTIVE while anyone is present,
 * EMPTY (terminal) once the last participant is gone.
 */
public enum SessionState {
    CREATED,
    ACTIVE,
    EMPTY
}
