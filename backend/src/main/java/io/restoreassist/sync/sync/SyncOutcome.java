package io.restoreassist.sync.sync;

/** How the orchestrator finished with a dequeued job. */
public enum SyncOutcome {
  SUCCEEDED,
  RETRY_SCHEDULED,
  FAILED,
  /** Put back without calling the provider (circuit open or rate limited). */
  DEFERRED,
  /** The invoice is gone or no longer PENDING for this provider. */
  SKIPPED
}
