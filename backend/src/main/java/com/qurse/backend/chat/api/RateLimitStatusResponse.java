package com.qurse.backend.chat.api;

public record RateLimitStatusResponse(
    boolean isRateLimited, Integer remaining, long resetTime, String layer, String limit) {}
