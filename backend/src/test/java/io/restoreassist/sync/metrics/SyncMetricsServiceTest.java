package io.restoreassist.sync.metrics;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.benmanes.caffeine.cache.Ticker;
import io.restoreassist.sync.integration.IntegrationProvider;
import io.restoreassist.sync.testutil.MutableClock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SyncMetricsServiceTest {

  private MutableClock clock;
  private FakeTicker ticker;
  private SyncMetricsService metrics;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2025-05-06T10:00:00Z");
    ticker = new FakeTicker();
    metrics = new SyncMetricsService(Duration.ofMinutes(15), clock, ticker);
  }

  @Test
  void rollingWindow_emptyWindowHasNoAverage() {
    var stats = metrics.rollingWindow();

    assertThat(stats.windowSeconds()).isEqualTo(900);
    assertThat(stats.successes()).isZero();
    assertThat(stats.averageDurationMs()).isNull();
    assertThat(stats.byProvider()).isEmpty();
  }

  @Test
  void rollingWindow_totalsOutcomesOverallAndPerProvider() {
    metrics.recordSuccess(IntegrationProvider.XERO, Duration.ofMillis(200));
    metrics.recordSuccess(IntegrationProvider.XERO, Duration.ofMillis(400));
    metrics.recordFailure(IntegrationProvider.MYOB, Duration.ofMillis(900));
    metrics.recordRetry(IntegrationProvider.MYOB, Duration.ofMillis(500));
    metrics.recordDeferral(IntegrationProvider.QUICKBOOKS);

    var stats = metrics.rollingWindow();

    assertThat(stats.successes()).isEqualTo(2);
    assertThat(stats.failures()).isEqualTo(1);
    assertThat(stats.retries()).isEqualTo(1);
    assertThat(stats.deferrals()).isEqualTo(1);
    assertThat(stats.averageDurationMs()).isEqualTo(500.0);
    assertThat(stats.byProvider().get("xero").averageDurationMs()).isEqualTo(300.0);
    assertThat(stats.byProvider().get("myob").failures()).isEqualTo(1);
    assertThat(stats.byProvider().get("quickbooks").averageDurationMs()).isNull();
  }

  @Test
  void rollingWindow_outcomesOlderThanWindowDropOut() {
    metrics.recordSuccess(IntegrationProvider.XERO, Duration.ofMillis(100));
    clock.advance(Duration.ofMinutes(10));
    metrics.recordFailure(IntegrationProvider.XERO, Duration.ofMillis(100));

    assertThat(metrics.rollingWindow().successes()).isEqualTo(1);

    clock.advance(Duration.ofMinutes(6));
    var stats = metrics.rollingWindow();

    assertThat(stats.successes()).isZero();
    assertThat(stats.failures()).isEqualTo(1);
  }

  @Test
  void rollingWindow_dropsExpiredBuckets() {
    metrics.recordSuccess(IntegrationProvider.XERO, Duration.ofMillis(100));

    ticker.advance(Duration.ofMinutes(17).toNanos());

    assertThat(metrics.rollingWindow().successes()).isZero();
  }

  /** Fake ticker for simulating time passage in Caffeine caches. */
  private static class FakeTicker implements Ticker {
    private final AtomicLong nanos = new AtomicLong(System.nanoTime());

    void advance(long deltaNanos) {
      nanos.addAndGet(deltaNanos);
    }

    @Override
    public long read() {
      return nanos.get();
    }
  }
}
