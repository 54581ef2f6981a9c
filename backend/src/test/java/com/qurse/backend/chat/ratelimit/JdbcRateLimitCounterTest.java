package com.qurse.backend.chat.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;

import com.qurse.backend.support.PostgresTestContainer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@JdbcTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JdbcRateLimitCounterTest extends PostgresTestContainer {

  private static final RateLimitWindow TODAY =
      RateLimitWindow.today(Clock.fixed(Instant.parse("2025-03-01T10:00:00Z"), ZoneOffset.UTC));
  private static final RateLimitWindow TOMORROW =
      RateLimitWindow.today(Clock.fixed(Instant.parse("2025-03-02T10:00:00Z"), ZoneOffset.UTC));

  @Autowired private JdbcTemplate jdbcTemplate;

  private JdbcRateLimitCounter counter;

  @BeforeEach
  void setUp() {
    jdbcTemplate.execute("DELETE FROM rate_limit_counter");
    counter = new JdbcRateLimitCounter(jdbcTemplate);
  }

  @AfterEach
  void tearDown() {
    jdbcTemplate.execute("DELETE FROM rate_limit_counter");
  }

  @Test
  void incrementReturnsCountAfterIncrement() {
    assertThat(counter.current("user:u1", TODAY)).isZero();

    assertThat(counter.increment("user:u1", TODAY)).isEqualTo(1);
    assertThat(counter.increment("user:u1", TODAY)).isEqualTo(2);

    assertThat(counter.current("user:u1", TODAY)).isEqualTo(2);
    assertThat(counter.current("user:u2", TODAY)).isZero();
  }

  @Test
  void newWindowStartsFromZero() {
    counter.increment("session:abc", TODAY);
    counter.increment("session:abc", TODAY);

    assertThat(counter.increment("session:abc", TOMORROW)).isEqualTo(1);
    assertThat(counter.current("session:abc", TODAY)).isEqualTo(2);
  }

  @Test
  void limiterTimeoutBecomesStatementTimeout() {
    JdbcRateLimitCounter bounded = new JdbcRateLimitCounter(jdbcTemplate, Duration.ofMillis(500));

    assertThat(bounded.queryTimeoutSeconds()).isEqualTo(1);
    assertThat(JdbcRateLimitCounter.querySeconds(Duration.ofMillis(2500))).isEqualTo(3);
    assertThat(bounded.increment("user:u3", TODAY)).isEqualTo(1);
  }

  @Test
  void concurrentIncrementsAreNeverLost() throws Exception {
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<Callable<Integer>> tasks = new ArrayList<>();
      for (int index = 0; index < 40; index++) {
        tasks.add(() -> counter.increment("ip:203.0.113.9", TODAY));
      }
      List<Integer> results = new ArrayList<>();
      for (Future<Integer> future : executor.invokeAll(tasks)) {
        results.add(future.get());
      }

      assertThat(results).doesNotHaveDuplicates().hasSize(40);
      assertThat(counter.current("ip:203.0.113.9", TODAY)).isEqualTo(40);
    } finally {
      executor.shutdownNow();
    }
  }
}
