package com.qurse.backend.chat.stream;

import com.qurse.backend.chat.api.ChatMessagePayload;
import com.qurse.backend.chat.provider.ChatProviderSelection;
import java.util.List;

public record GenerationRequest(
    ChatProviderSelection selection, String systemPrompt, List<ChatMessagePayload> messages) {}
