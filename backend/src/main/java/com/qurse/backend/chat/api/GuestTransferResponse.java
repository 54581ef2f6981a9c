package com.qurse.backend.chat.api;

/**
 * @param rateLimitWindowsTransferred daily counter windows merged into the user's quota
 */
public record GuestTransferResponse(int conversationsTransferred, int rateLimitWindowsTransferred) {

  public static GuestTransferResponse nothing() {
    return new GuestTransferResponse(0, 0);
  }
}
