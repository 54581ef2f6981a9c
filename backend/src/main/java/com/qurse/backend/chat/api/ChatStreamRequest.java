package com.qurse.backend.chat.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;

public record ChatStreamRequest(
    @Schema(
            description =
                "Conversation identifier. Absent or temp-prefixed ids start a new conversation.",
            example = "temp-5b0c7d2e-6a3f-4d1e-9c2b-0f8e7a6d5c4b")
        String conversationId,
    @Schema(description = "Model id from the catalog", example = "openai/gpt-oss-120b")
        String model,
    @Schema(description = "Chat mode", example = "chat") String chatMode,
    @Schema(description = "Full conversation history, oldest first")
        @NotNull(message = "messages are required")
        @Size(min = 1, max = 100, message = "messages must contain between 1 and 100 entries")
        List<@Valid @NotNull ChatMessagePayload> messages) {}
