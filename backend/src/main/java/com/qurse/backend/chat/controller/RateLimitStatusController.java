package com.qurse.backend.chat.controller;

import com.qurse.backend.chat.api.RateLimitStatusResponse;
import com.qurse.backend.chat.identity.CallerIdentity;
import com.qurse.backend.chat.identity.IdentityResolver;
import com.qurse.backend.chat.ratelimit.RateLimitDecision;
import com.qurse.backend.chat.ratelimit.RateLimitHeaders;
import com.qurse.backend.chat.ratelimit.RateLimiter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/rate-limit")
public class RateLimitStatusController {

  private final IdentityResolver identityResolver;
  private final RateLimiter rateLimiter;

  public RateLimitStatusController(IdentityResolver identityResolver, RateLimiter rateLimiter) {
    this.identityResolver = identityResolver;
    this.rateLimiter = rateLimiter;
  }

  @GetMapping("/status")
  public ResponseEntity<RateLimitStatusResponse> status(
      HttpServletRequest httpRequest, HttpServletResponse httpResponse) {
    CallerIdentity identity = identityResolver.resolve(httpRequest, httpResponse);
    RateLimitDecision decision = rateLimiter.status(identity);
    return ResponseEntity.ok()
        .headers(RateLimitHeaders.from(decision))
        .body(toResponse(decision));
  }

  static RateLimitStatusResponse toResponse(RateLimitDecision decision) {
    long resetTime = decision.resetAt() != null ? decision.resetAt().toEpochMilli() : 0L;
    if (decision.isUnlimited()) {
      return new RateLimitStatusResponse(false, null, resetTime, decision.layer().wireName(), "unlimited");
    }
    return new RateLimitStatusResponse(
        !decision.allowed(),
        decision.remaining(),
        resetTime,
        decision.layer().wireName(),
        Integer.toString(decision.limit()));
  }
}
