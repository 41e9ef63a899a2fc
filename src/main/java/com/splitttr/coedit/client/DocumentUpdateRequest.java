package com.splitttr.coedit.client;

public record DocumentUpdateRequest(
    String title,       // null keeps the current title
    String content,
    String updatedBy
) {}
