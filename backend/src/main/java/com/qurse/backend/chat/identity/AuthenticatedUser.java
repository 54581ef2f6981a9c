package com.qurse.backend.chat.identity;

public record AuthenticatedUser(String userId, boolean entitled) {}
