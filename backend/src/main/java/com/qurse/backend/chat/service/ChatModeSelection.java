package com.qurse.backend.chat.service;

import java.util.List;

public record ChatModeSelection(String id, String systemPrompt, List<String> enabledTools) {}
