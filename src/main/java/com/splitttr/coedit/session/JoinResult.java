package com.splitttr.coedit.session;

public record JoinResult(String sessionId, SessionSnapshot snapshot) {}
