package io.restoreassist.sync.sync;

import io.github.resilience4j.core.IntervalFunction;
import io.restoreassist.sync.config.SyncProperties;
import io.restoreassist.sync.integration.IntegrationRegistry;
import io.restoreassist.sync.integration.accounting.AccountingSyncResult;
import io.restoreassist.sync.integration.accounting.InvoiceSyncRequest;
import io.restoreassist.sync.integration.accounting.PermanentProviderException;
import io.restoreassist.sync.integration.accounting.ProviderErrorClassifier;
import io.restoreassist.sync.integration.accounting.ProviderException;
import io.restoreassist.sync.integration.accounting.RateLimitedException;
import io.restoreassist.sync.integration.accounting.TransientProviderException;
import io.restoreassist.sync.integration.resilience.CircuitBreakerRegistry;
import io.restoreassist.sync.integration.resilience.CircuitOpenException;
import io.restoreassist.sync.integration.resilience.ProviderCircuitBreaker;
import io.restoreassist.sync.integration.resilience.RateLimiterRegistry;
import io.restoreassist.sync.metrics.SyncMetricsService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Drives one {@link SyncJob} through breaker, limiter and provider call, then records the outcome.
 *
 * <p>The provider call runs on {@code providerCallExecutor} with a bounded timeout; the returned
 * future completes once the outcome is persisted. Deferrals (breaker open, limiter empty, provider
 * 429) put the job back without consuming an attempt. Retry delays grow exponentially from {@code
 * retry.baseDelay}, randomized by {@code retry.jitterRatio} and capped at {@code retry.maxDelay}.
 */
@Service
public class SyncOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

  private static final double BACKOFF_MULTIPLIER = 2.0;

  private final SyncQueue syncQueue;
  private final CircuitBreakerRegistry circuitBreakers;
  private final RateLimiterRegistry rateLimiters;
  private final IntegrationRegistry integrationRegistry;
  private final SyncStateRecorder stateRecorder;
  private final SyncMetricsService metrics;
  private final Executor providerCallExecutor;
  private final IntervalFunction retryBackoff;
  private final int maxRetries;
  private final Duration providerTimeout;
  private final Clock clock;

  public SyncOrchestrator(
      SyncQueue syncQueue,
      CircuitBreakerRegistry circuitBreakers,
      RateLimiterRegistry rateLimiters,
      IntegrationRegistry integrationRegistry,
      SyncStateRecorder stateRecorder,
      SyncMetricsService metrics,
      @Qualifier("providerCallExecutor") Executor providerCallExecutor,
      SyncProperties properties,
      Clock clock) {
    this(
        syncQueue,
        circuitBreakers,
        rateLimiters,
        integrationRegistry,
        stateRecorder,
        metrics,
        providerCallExecutor,
        IntervalFunction.ofExponentialRandomBackoff(
            properties.retry().baseDelay(),
            BACKOFF_MULTIPLIER,
            properties.retry().jitterRatio(),
            properties.retry().maxDelay()),
        properties,
        clock);
  }

  SyncOrchestrator(
      SyncQueue syncQueue,
      CircuitBreakerRegistry circuitBreakers,
      RateLimiterRegistry rateLimiters,
      IntegrationRegistry integrationRegistry,
      SyncStateRecorder stateRecorder,
      SyncMetricsService metrics,
      Executor providerCallExecutor,
      IntervalFunction retryBackoff,
      SyncProperties properties,
      Clock clock) {
    this.syncQueue = syncQueue;
    this.circuitBreakers = circuitBreakers;
    this.rateLimiters = rateLimiters;
    this.integrationRegistry = integrationRegistry;
    this.stateRecorder = stateRecorder;
    this.metrics = metrics;
    this.providerCallExecutor = providerCallExecutor;
    this.retryBackoff = retryBackoff;
    this.maxRetries = properties.retry().maxRetries();
    this.providerTimeout = properties.providerTimeout();
    this.clock = clock;
  }

  public CompletableFuture<SyncOutcome> process(SyncJob job) {
    var request = stateRecorder.prepare(job);
    if (request.isEmpty()) {
      log.info("Dropping sync job {}: invoice no longer pending for {}", job.id(), job.provider());
      return CompletableFuture.completedFuture(SyncOutcome.SKIPPED);
    }

    var breaker = circuitBreakers.forProvider(job.provider());
    ProviderCircuitBreaker.Permit permit;
    try {
      permit = breaker.acquirePermission();
    } catch (CircuitOpenException e) {
      syncQueue.defer(job, e.getRetryAfter());
      stateRecorder.recordCircuitOpenDeferral(job, e.getRetryAfter());
      metrics.recordDeferral(job.provider());
      log.warn(
          "Circuit open for provider={}, deferring job {} by {}ms",
          job.provider(),
          job.id(),
          e.getRetryAfter().toMillis());
      return CompletableFuture.completedFuture(SyncOutcome.DEFERRED);
    }

    var decision = rateLimiters.forProvider(job.provider()).tryAcquire();
    if (!decision.allowed()) {
      breaker.releasePermission(permit);
      syncQueue.defer(job, decision.retryAfter());
      metrics.recordDeferral(job.provider());
      log.info(
          "Rate limit reached for provider={}, deferring job {} by {}ms",
          job.provider(),
          job.id(),
          decision.retryAfter().toMillis());
      return CompletableFuture.completedFuture(SyncOutcome.DEFERRED);
    }

    var startedAt = clock.instant();
    return callProvider(request.get(), job)
        .handle(
            (result, error) ->
                error == null
                    ? onSuccess(job, breaker, permit, result, startedAt)
                    : onFailure(job, breaker, permit, error, startedAt));
  }

  private CompletableFuture<AccountingSyncResult> callProvider(
      InvoiceSyncRequest request, SyncJob job) {
    CompletableFuture<AccountingSyncResult> call;
    try {
      var client = integrationRegistry.resolve(job.provider());
      call = CompletableFuture.supplyAsync(() -> client.syncInvoice(request), providerCallExecutor);
    } catch (RuntimeException e) {
      // Executor rejection or missing client: surfaces through the same classification path.
      call = CompletableFuture.failedFuture(e);
    }
    return call.orTimeout(providerTimeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  private SyncOutcome onSuccess(
      SyncJob job,
      ProviderCircuitBreaker breaker,
      ProviderCircuitBreaker.Permit permit,
      AccountingSyncResult result,
      Instant startedAt) {
    var elapsed = elapsedSince(startedAt);
    breaker.onSuccess(permit, elapsed);
    metrics.recordSuccess(job.provider(), elapsed);
    boolean recorded;
    try {
      recorded = stateRecorder.recordSuccess(job, result.externalId());
    } catch (RuntimeException e) {
      // The document exists remotely; the bumped attempt makes the next push look it up first.
      var delay = backoffFor(job);
      syncQueue.requeue(job, delay);
      log.error(
          "Invoice {} reached provider={} as {} but recording it failed, retry in {}ms",
          job.invoiceId(),
          job.provider(),
          result.externalId(),
          delay.toMillis(),
          e);
      return SyncOutcome.RETRY_SCHEDULED;
    }
    if (recorded) {
      log.info(
          "Invoice {} synced to provider={} externalId={}",
          job.invoiceId(),
          job.provider(),
          result.externalId());
    }
    return SyncOutcome.SUCCEEDED;
  }

  private SyncOutcome onFailure(
      SyncJob job,
      ProviderCircuitBreaker breaker,
      ProviderCircuitBreaker.Permit permit,
      Throwable error,
      Instant startedAt) {
    var classified = ProviderErrorClassifier.classify(job.provider(), error);
    var elapsed = elapsedSince(startedAt);

    if (classified instanceof RateLimitedException rateLimited) {
      breaker.releasePermission(permit);
      var retryAfter = rateLimited.getRetryAfter();
      rateLimiters.forProvider(job.provider()).drainUntil(clock.instant().plus(retryAfter));
      syncQueue.defer(job, retryAfter);
      metrics.recordDeferral(job.provider());
      log.warn(
          "Provider={} answered 429 for job {}, deferring by {}ms",
          job.provider(),
          job.id(),
          retryAfter.toMillis());
      return SyncOutcome.DEFERRED;
    }

    if (classified instanceof TransientProviderException) {
      breaker.onFailure(permit, elapsed, classified);
      if (job.attempt() < maxRetries) {
        var delay = backoffFor(job);
        var next = syncQueue.requeue(job, delay);
        stateRecorder.recordRetry(next, classified, delay);
        metrics.recordRetry(job.provider(), elapsed);
        log.warn(
            "Transient failure syncing invoice {} to provider={} (attempt {}), retry in {}ms: {}",
            job.invoiceId(),
            job.provider(),
            next.attempt(),
            delay.toMillis(),
            classified.getMessage());
        return SyncOutcome.RETRY_SCHEDULED;
      }
      return fail(job, classified, elapsed);
    }

    // Permanent, including auth expiry: says nothing about provider health.
    breaker.releasePermission(permit);
    return fail(job, classified, elapsed);
  }

  private SyncOutcome fail(SyncJob job, ProviderException error, Duration elapsed) {
    stateRecorder.recordFailure(job, error);
    metrics.recordFailure(job.provider(), elapsed);
    log.error(
        "Sync of invoice {} to provider={} failed after {} attempt(s) [{}]: {}",
        job.invoiceId(),
        job.provider(),
        job.attempt() + 1,
        error instanceof PermanentProviderException ? "permanent" : "retries exhausted",
        error.getMessage());
    return SyncOutcome.FAILED;
  }

  private Duration backoffFor(SyncJob job) {
    return Duration.ofMillis(retryBackoff.apply(job.attempt() + 1));
  }

  private Duration elapsedSince(Instant startedAt) {
    return Duration.between(startedAt, clock.instant());
  }
}
