package com.qurse.backend.chat.provider;

public record ChatProviderSelection(String providerId, String modelId) {}
