package com.qurse.backend.chat.api;

public record StopStreamResponse(boolean stopped) {}
