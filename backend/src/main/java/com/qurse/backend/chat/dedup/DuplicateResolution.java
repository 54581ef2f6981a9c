package com.qurse.backend.chat.dedup;

public record DuplicateResolution(
    AssistantCandidate keep, AssistantCandidate discard, DuplicateReason reason) {}
