package com.qurse.backend.chat.access;

import com.qurse.backend.chat.config.ChatProvidersProperties;
import com.qurse.backend.chat.identity.CallerIdentity;
import com.qurse.backend.chat.ratelimit.RateLimitDecision;
import com.qurse.backend.chat.ratelimit.RateLimitHeaders;
import com.qurse.backend.chat.ratelimit.RateLimiter;
import com.qurse.backend.common.exception.AccessDeniedException;
import com.qurse.backend.common.exception.RateLimitExceededException;
import com.qurse.backend.common.exception.RateLimitInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Entitlement and quota checks for a chat turn, cheapest first: authentication, subscription,
 * then the rate limiter. The limiter is only consulted when both entitlement checks pass.
 */
@Component
@Slf4j
public class AccessGate {

  private final RateLimiter rateLimiter;

  public AccessGate(RateLimiter rateLimiter) {
    this.rateLimiter = rateLimiter;
  }

  public AccessDecision check(CallerIdentity identity, ChatProvidersProperties.Model model) {
    if (model.isRequiresAuth() && !identity.isAuthenticated()) {
      return AccessDecision.deny(DenyReason.AUTH_REQUIRED, null);
    }
    if (model.isRequiresPro() && !identity.entitled()) {
      return AccessDecision.deny(DenyReason.SUBSCRIPTION_REQUIRED, null);
    }
    RateLimitDecision rateLimit = rateLimiter.check(identity);
    if (!rateLimit.allowed()) {
      return AccessDecision.deny(DenyReason.RATE_LIMITED, rateLimit);
    }
    return AccessDecision.allow(rateLimit);
  }

  /** Runs {@link #check} and converts a denial into the matching typed exception. */
  public RateLimitDecision enforce(CallerIdentity identity, ChatProvidersProperties.Model model) {
    AccessDecision decision = check(identity, model);
    if (decision.allowed()) {
      return decision.rateLimit();
    }
    DenyReason reason = decision.reason();
    log.debug("Access denied: {}", reason);
    if (reason == DenyReason.AUTH_REQUIRED) {
      throw AccessDeniedException.authenticationRequired(reason.message());
    }
    if (reason == DenyReason.SUBSCRIPTION_REQUIRED) {
      throw AccessDeniedException.forbidden(reason.message());
    }
    RateLimitDecision rateLimit = decision.rateLimit();
    throw new RateLimitExceededException(
        reason.message(),
        new RateLimitInfo(
            rateLimit.remaining(), rateLimit.resetAt().toEpochMilli(), rateLimit.layer().wireName()),
        RateLimitHeaders.from(rateLimit));
  }
}
