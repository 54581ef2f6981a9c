package com.qurse.backend.chat.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record StoppedMessageRequest(
    @Schema(description = "Durable conversation id") @NotBlank(message = "conversationId is required")
        String conversationId,
    @Schema(description = "Partial assistant message as rendered by the client")
        @NotNull(message = "message is required")
        @Valid
        ChatMessagePayload message,
    @Schema(description = "Model that produced the partial message") String model) {}
