package com.qurse.backend.chat.access;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.qurse.backend.chat.config.ChatProvidersProperties;
import com.qurse.backend.chat.identity.CallerIdentity;
import com.qurse.backend.chat.ratelimit.RateLimitDecision;
import com.qurse.backend.chat.ratelimit.RateLimitLayer;
import com.qurse.backend.chat.ratelimit.RateLimiter;
import com.qurse.backend.common.exception.AccessDeniedException;
import com.qurse.backend.common.exception.RateLimitExceededException;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class AccessGateTest {

  private static final Instant RESET = Instant.parse("2025-03-02T00:00:00Z");
  private static final CallerIdentity GUEST =
      CallerIdentity.guest("session-1", "hash-1", "203.0.113.7");
  private static final CallerIdentity FREE_USER = CallerIdentity.user("user-1", false, "203.0.113.8");
  private static final CallerIdentity PRO_USER = CallerIdentity.user("user-2", true, "203.0.113.9");

  @Mock private RateLimiter rateLimiter;

  @InjectMocks private AccessGate accessGate;

  @Test
  void guestIsDeniedAuthModelWithoutTouchingTheLimiter() {
    AccessDecision decision = accessGate.check(GUEST, model(true, false));

    assertThat(decision.allowed()).isFalse();
    assertThat(decision.reason()).isEqualTo(DenyReason.AUTH_REQUIRED);
    assertThat(decision.rateLimit()).isNull();
    verify(rateLimiter, never()).check(any());
  }

  @Test
  void freeUserIsDeniedProModel() {
    assertThatThrownBy(() -> accessGate.enforce(FREE_USER, model(true, true)))
        .isInstanceOf(AccessDeniedException.class)
        .extracting(ex -> ((AccessDeniedException) ex).getStatus())
        .isEqualTo(HttpStatus.FORBIDDEN);
    verify(rateLimiter, never()).check(any());
  }

  @Test
  void guestOnRestrictedModelGetsUnauthorized() {
    assertThatThrownBy(() -> accessGate.enforce(GUEST, model(true, true)))
        .isInstanceOf(AccessDeniedException.class)
        .extracting(ex -> ((AccessDeniedException) ex).getStatus())
        .isEqualTo(HttpStatus.UNAUTHORIZED);
  }

  @Test
  void exhaustedQuotaBecomesRateLimitException() {
    when(rateLimiter.check(GUEST))
        .thenReturn(
            new RateLimitDecision(false, 10, 0, RESET, RateLimitLayer.DATABASE, false, "daily limit"));

    assertThatThrownBy(() -> accessGate.enforce(GUEST, model(false, false)))
        .isInstanceOfSatisfying(
            RateLimitExceededException.class,
            ex -> {
              assertThat(ex.getStatus()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
              assertThat(ex.getRateLimitInfo().remaining()).isZero();
              assertThat(ex.getRateLimitInfo().resetTime()).isEqualTo(RESET.toEpochMilli());
              assertThat(ex.getRateLimitInfo().layer()).isEqualTo("database");
              assertThat(ex.getHeaders().getFirst("X-RateLimit-Remaining")).isEqualTo("0");
            });
  }

  @Test
  void entitledUserPassesWithLimiterDecision() {
    RateLimitDecision unlimited = RateLimitDecision.unlimited(RESET);
    when(rateLimiter.check(PRO_USER)).thenReturn(unlimited);

    assertThat(accessGate.enforce(PRO_USER, model(true, true))).isEqualTo(unlimited);
  }

  private static ChatProvidersProperties.Model model(boolean requiresAuth, boolean requiresPro) {
    ChatProvidersProperties.Model model = new ChatProvidersProperties.Model();
    model.setRequiresAuth(requiresAuth);
    model.setRequiresPro(requiresPro);
    return model;
  }
}
