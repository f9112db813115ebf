package io.restoreassist.sync.sync;

import io.restoreassist.sync.integration.IntegrationProvider;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Pending sync jobs, at most one per (invoice, provider), yielded by priority then enqueue time.
 */
public interface SyncQueue {

  /**
   * Adds a job. If a job for the same invoice and provider is already queued it is updated in
   * place (higher priority and earlier eligibility win) and its id is returned instead.
   */
  UUID enqueue(SyncJob job);

  /**
   * Non-blocking poll for the highest-priority job whose eligible time has passed, oldest first
   * within a priority. Empty when nothing is eligible.
   */
  Optional<SyncJob> dequeue();

  /** Re-inserts a failed job with {@code attempt + 1}, eligible after {@code delay}. */
  SyncJob requeue(SyncJob job, Duration delay);

  /** Re-inserts a job that was not attempted, keeping its attempt count. */
  SyncJob defer(SyncJob job, Duration delay);

  boolean contains(UUID invoiceId, IntegrationProvider provider);

  boolean remove(UUID invoiceId, IntegrationProvider provider);

  int depth();

  Map<IntegrationProvider, Integer> depthByProvider();

  /** Age of the longest-waiting job, empty when the queue is empty. */
  Optional<Duration> oldestJobAge();
}
