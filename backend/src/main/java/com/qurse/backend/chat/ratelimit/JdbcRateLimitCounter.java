package com.qurse.backend.chat.ratelimit;

import java.sql.Timestamp;
import java.time.Duration;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;

/** Durable counter of record, one row per subject and window. */
public class JdbcRateLimitCounter implements RateLimitCounter {

  private static final String INCREMENT_SQL =
      """
      INSERT INTO rate_limit_counter (subject_key, window_start, request_count, updated_at)
      VALUES (?, ?, 1, now())
      ON CONFLICT (subject_key, window_start)
      DO UPDATE SET request_count = rate_limit_counter.request_count + 1, updated_at = now()
      RETURNING request_count
      """;

  private static final String SELECT_SQL =
      "SELECT request_count FROM rate_limit_counter WHERE subject_key = ? AND window_start = ?";

  private static final String MERGE_SQL =
      """
      INSERT INTO rate_limit_counter (subject_key, window_start, request_count, updated_at)
      SELECT ?, window_start, request_count, now() FROM rate_limit_counter WHERE subject_key = ?
      ON CONFLICT (subject_key, window_start)
      DO UPDATE SET request_count = rate_limit_counter.request_count + EXCLUDED.request_count,
                    updated_at = now()
      """;

  private static final String DELETE_SQL = "DELETE FROM rate_limit_counter WHERE subject_key = ?";

  private final JdbcTemplate jdbcTemplate;

  public JdbcRateLimitCounter(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  /**
   * Counter whose statements are cancelled by the driver after {@code queryTimeout}, rounded up to
   * whole seconds, so a stalled database does not pin a limiter worker.
   */
  public JdbcRateLimitCounter(JdbcTemplate jdbcTemplate, Duration queryTimeout) {
    JdbcTemplate bounded = new JdbcTemplate(jdbcTemplate.getDataSource());
    bounded.setQueryTimeout(querySeconds(queryTimeout));
    this.jdbcTemplate = bounded;
  }

  static int querySeconds(Duration timeout) {
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      return 1;
    }
    long millis = timeout.toMillis();
    return (int) Math.max(1, (millis + 999) / 1000);
  }

  int queryTimeoutSeconds() {
    return jdbcTemplate.getQueryTimeout();
  }

  @Override
  public int increment(String subjectKey, RateLimitWindow window) {
    Integer count =
        jdbcTemplate.queryForObject(
            INCREMENT_SQL, Integer.class, subjectKey, Timestamp.from(window.start()));
    if (count == null) {
      throw new IllegalStateException("Rate limit upsert returned no count for " + subjectKey);
    }
    return count;
  }

  @Override
  public int current(String subjectKey, RateLimitWindow window) {
    List<Integer> counts =
        jdbcTemplate.queryForList(
            SELECT_SQL, Integer.class, subjectKey, Timestamp.from(window.start()));
    return counts.isEmpty() || counts.get(0) == null ? 0 : counts.get(0);
  }

  /**
   * Adds every window counted under {@code fromKey} to {@code toKey} and removes the source rows.
   * Returns the number of windows moved.
   */
  public int transfer(String fromKey, String toKey) {
    jdbcTemplate.update(MERGE_SQL, toKey, fromKey);
    return jdbcTemplate.update(DELETE_SQL, fromKey);
  }

  @Override
  public RateLimitLayer layer() {
    return RateLimitLayer.DATABASE;
  }
}
