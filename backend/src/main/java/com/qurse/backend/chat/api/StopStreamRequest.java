package com.qurse.backend.chat.api;

import jakarta.validation.constraints.NotBlank;

public record StopStreamRequest(@NotBlank(message = "conversationId is required") String conversationId) {}
