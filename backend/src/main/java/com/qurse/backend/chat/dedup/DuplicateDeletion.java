package com.qurse.backend.chat.dedup;

import java.time.Instant;
import java.util.UUID;

public record DuplicateDeletion(
    UUID id, UUID keptId, UUID conversationId, Instant createdAt, String reason) {}
