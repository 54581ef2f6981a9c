package com.qurse.backend.chat.api;

/**
 * @param saved false when the message was recognised as a duplicate of one already stored
 */
public record MessageSaveResponse(boolean success, boolean saved) {}
