package io.restoreassist.sync.sync;

import io.restoreassist.sync.config.SyncProperties;
import java.time.Duration;
import java.util.concurrent.Semaphore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Pulls eligible jobs off the {@link SyncQueue} and hands them to the {@link SyncOrchestrator}.
 * At most {@code worker.count} jobs are in flight; a permit is returned when the job's outcome has
 * been recorded, not when the dispatcher moves on.
 */
@Component
public class SyncWorkerPool {

  private static final Logger log = LoggerFactory.getLogger(SyncWorkerPool.class);

  static final String MDC_INVOICE_ID = "invoiceId";
  static final String MDC_PROVIDER = "provider";
  static final String MDC_JOB_ID = "jobId";

  /** Delay before a job is tried again after the orchestrator itself blew up. */
  static final Duration RECOVERY_DELAY = Duration.ofSeconds(5);

  private final SyncQueue syncQueue;
  private final SyncOrchestrator orchestrator;
  private final Semaphore permits;

  public SyncWorkerPool(
      SyncQueue syncQueue, SyncOrchestrator orchestrator, SyncProperties properties) {
    this.syncQueue = syncQueue;
    this.orchestrator = orchestrator;
    this.permits = new Semaphore(properties.worker().count());
  }

  @Scheduled(fixedDelayString = "${restoreassist.sync.worker.poll-interval-ms:250}")
  public void dispatch() {
    while (permits.tryAcquire()) {
      var next = syncQueue.dequeue();
      if (next.isEmpty()) {
        permits.release();
        return;
      }
      start(next.get());
    }
  }

  int availableWorkers() {
    return permits.availablePermits();
  }

  private void start(SyncJob job) {
    putContext(job);
    try {
      log.debug("Processing sync job attempt={}", job.attempt());
      orchestrator
          .process(job)
          .whenComplete(
              (outcome, error) -> {
                putContext(job);
                try {
                  if (error != null) {
                    recover(job, error);
                  } else {
                    log.debug("Sync job finished with outcome={}", outcome);
                  }
                } finally {
                  permits.release();
                  MDC.clear();
                }
              });
    } catch (RuntimeException e) {
      try {
        recover(job, e);
      } finally {
        permits.release();
      }
    } finally {
      MDC.clear();
    }
  }

  private void recover(SyncJob job, Throwable error) {
    log.error("Sync job {} failed unexpectedly, deferring by {}", job.id(), RECOVERY_DELAY, error);
    syncQueue.defer(job, RECOVERY_DELAY);
  }

  private static void putContext(SyncJob job) {
    MDC.put(MDC_INVOICE_ID, job.invoiceId().toString());
    MDC.put(MDC_PROVIDER, job.provider().getSlug());
    MDC.put(MDC_JOB_ID, job.id().toString());
  }
}
