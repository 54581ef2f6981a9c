package com.qurse.backend.chat.ratelimit;

import com.qurse.backend.chat.config.RateLimitProperties;
import com.qurse.backend.chat.identity.CallerIdentity;
import com.qurse.backend.chat.metrics.ChatMetrics;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.IntSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Daily message quotas.
 *
 * <ul>
 *   <li>Guests: per-IP fast counter first, then the durable per-session counter.
 *   <li>Authenticated free users: durable per-user counter.
 *   <li>Entitled users: counted for tracking, never denied.
 * </ul>
 *
 * <p>Every counter call is bounded by {@link RateLimitProperties#getTimeout()} and runs on a
 * fixed-size executor. A tier that fails, times out or finds the executor saturated lets the
 * request through with {@link RateLimitDecision#degraded()} set, so the outage is visible in
 * headers, logs and metrics instead of being silent.
 */
public class TieredRateLimiter implements RateLimiter {

  private static final Logger log = LoggerFactory.getLogger(TieredRateLimiter.class);

  private final RateLimitCounter fastCounter;
  private final RateLimitCounter durableCounter;
  private final RateLimitProperties properties;
  private final Executor executor;
  private final ChatMetrics metrics;
  private final Clock clock;

  public TieredRateLimiter(
      RateLimitCounter fastCounter,
      RateLimitCounter durableCounter,
      RateLimitProperties properties,
      Executor executor,
      ChatMetrics metrics,
      Clock clock) {
    this.fastCounter = fastCounter;
    this.durableCounter = durableCounter;
    this.properties = properties;
    this.executor = executor;
    this.metrics = metrics;
    this.clock = clock;
  }

  public static String userSubject(String userId) {
    return "user:" + userId;
  }

  public static String sessionSubject(String sessionHash) {
    return "session:" + sessionHash;
  }

  @Override
  public RateLimitDecision check(CallerIdentity identity) {
    RateLimitWindow window = RateLimitWindow.today(clock);
    RateLimitDecision decision = evaluate(identity, window, true);
    if (metrics != null) {
      metrics.recordRateLimitDecision(
          decision.layer().wireName(), decision.allowed(), decision.degraded());
    }
    if (!decision.allowed()) {
      log.info(
          "Rate limit reached for {} on layer {} (limit {})",
          describe(identity),
          decision.layer().wireName(),
          decision.limit());
    }
    return decision;
  }

  @Override
  public RateLimitDecision status(CallerIdentity identity) {
    return evaluate(identity, RateLimitWindow.today(clock), false);
  }

  private RateLimitDecision evaluate(
      CallerIdentity identity, RateLimitWindow window, boolean increment) {
    if (identity.isAuthenticated()) {
      String subject = userSubject(identity.userId());
      if (identity.entitled()) {
        if (increment) {
          countQuietly(durableCounter, subject, window);
        }
        return RateLimitDecision.unlimited(window.resetAt());
      }
      return consult(durableCounter, subject, properties.getFreeDailyLimit(), window, increment);
    }

    String ip = StringUtils.hasText(identity.clientIp()) ? identity.clientIp() : "unknown";
    RateLimitDecision fast =
        consult(fastCounter, "ip:" + ip, properties.getIpDailyLimit(), window, increment);
    if (!fast.allowed()) {
      return fast;
    }
    RateLimitDecision durable =
        consult(
            durableCounter,
            sessionSubject(identity.sessionHash()),
            properties.getGuestDailyLimit(),
            window,
            increment);
    if (fast.degraded() && !durable.degraded()) {
      return new RateLimitDecision(
          durable.allowed(),
          durable.limit(),
          durable.remaining(),
          durable.resetAt(),
          durable.layer(),
          true,
          durable.reason());
    }
    return durable;
  }

  private RateLimitDecision consult(
      RateLimitCounter counter,
      String subject,
      int limit,
      RateLimitWindow window,
      boolean increment) {
    IntSupplier call =
        increment
            ? () -> counter.increment(subject, window)
            : () -> counter.current(subject, window);
    try {
      int count = bounded(call);
      return increment
          ? RateLimitDecision.fromCount(count, limit, window.resetAt(), counter.layer())
          : RateLimitDecision.fromCurrent(count, limit, window.resetAt(), counter.layer());
    } catch (TimeoutException exception) {
      log.warn(
          "Rate limit {} tier timed out after {} for {}, allowing request",
          counter.layer().wireName(),
          properties.getTimeout(),
          subject);
    } catch (RejectedExecutionException exception) {
      log.warn(
          "Rate limit {} tier saturated, allowing request for {}",
          counter.layer().wireName(),
          subject);
    } catch (RuntimeException exception) {
      log.warn(
          "Rate limit {} tier failed for {}, allowing request",
          counter.layer().wireName(),
          subject,
          exception);
    }
    return RateLimitDecision.degradedAllow(limit, window.resetAt(), counter.layer());
  }

  private void countQuietly(RateLimitCounter counter, String subject, RateLimitWindow window) {
    try {
      bounded(() -> counter.increment(subject, window));
    } catch (TimeoutException | RuntimeException exception) {
      log.debug("Usage tracking failed for {}: {}", subject, exception.toString());
    }
  }

  private int bounded(IntSupplier call) throws TimeoutException {
    Duration timeout = properties.getTimeout();
    CompletableFuture<Integer> future = CompletableFuture.supplyAsync(call::getAsInt, executor);
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException exception) {
      future.cancel(true);
      throw exception;
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for rate limiter", exception);
    } catch (ExecutionException exception) {
      Throwable cause = exception.getCause();
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      throw new IllegalStateException("Rate limit counter failed", cause);
    }
  }

  private String describe(CallerIdentity identity) {
    return identity.isAuthenticated() ? "user " + identity.userId() : "guest session";
  }
}
