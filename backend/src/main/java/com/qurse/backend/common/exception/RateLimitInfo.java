package com.qurse.backend.common.exception;

/**
 * Quota snapshot returned with 429 responses.
 *
 * @param resetTime epoch milliseconds when the window resets
 */
public record RateLimitInfo(int remaining, long resetTime, String layer) {}
