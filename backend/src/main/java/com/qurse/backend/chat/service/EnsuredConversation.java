package com.qurse.backend.chat.service;

import java.util.UUID;

/**
 * @param created true when this call inserted the row
 */
public record EnsuredConversation(UUID id, boolean created) {}
