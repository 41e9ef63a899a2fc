package com.splitttr.coedit.session;

public enum PresenceUpdate {
    CHANGED,
    UNCHANGED,
    UNKNOWN_PARTICIPANT
}
