package com.splitttr.coedit.client;

import java.time.Instant;

public record DocumentResponse(
    String id,
    String title,
    String content,
    Instant updatedAt,
    long version
) {}
