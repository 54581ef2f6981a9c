package com.qurse.backend.chat.controller;

import com.qurse.backend.chat.api.GuestTransferResponse;
import com.qurse.backend.chat.identity.CallerIdentity;
import com.qurse.backend.chat.identity.IdentityResolver;
import com.qurse.backend.chat.service.GuestTransferService;
import com.qurse.backend.common.exception.AccessDeniedException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Optional;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Called once after sign-in, with the gateway's user headers and the browser's anonymous session
 * cookie on the same request.
 */
@RestController
@RequestMapping("/api/identity")
public class GuestTransferController {

  private final IdentityResolver identityResolver;
  private final GuestTransferService guestTransferService;

  public GuestTransferController(
      IdentityResolver identityResolver, GuestTransferService guestTransferService) {
    this.identityResolver = identityResolver;
    this.guestTransferService = guestTransferService;
  }

  @PostMapping("/guest-transfer")
  public GuestTransferResponse transfer(
      HttpServletRequest httpRequest, HttpServletResponse httpResponse) {
    CallerIdentity identity = identityResolver.resolve(httpRequest, httpResponse);
    if (!identity.isAuthenticated()) {
      throw AccessDeniedException.authenticationRequired("Sign in to keep your guest conversations");
    }
    Optional<String> sessionHash = identityResolver.presentedSessionHash(httpRequest);
    if (sessionHash.isEmpty()) {
      return GuestTransferResponse.nothing();
    }
    return guestTransferService.transfer(sessionHash.get(), identity.userId());
  }
}
