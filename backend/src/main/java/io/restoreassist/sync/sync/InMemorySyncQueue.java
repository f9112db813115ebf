package io.restoreassist.sync.sync;

import io.restoreassist.sync.integration.IntegrationProvider;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Process-local {@link SyncQueue}. Jobs are partitioned into one lane per provider, each with its
 * own lock, so providers never contend. {@link #dequeue()} starts at a rotating lane so a busy
 * provider cannot starve the others. Durability comes from the invoice's PENDING status, see
 * {@link SyncQueueRecovery}.
 */
@Component
public class InMemorySyncQueue implements SyncQueue {

  private static final Logger log = LoggerFactory.getLogger(InMemorySyncQueue.class);

  private static final Comparator<QueuedJob> DEQUEUE_ORDER =
      Comparator.comparing((QueuedJob q) -> q.job().priority())
          .thenComparing(q -> q.job().enqueuedAt())
          .thenComparingLong(QueuedJob::sequence);

  private final Map<IntegrationProvider, Lane> lanes = new EnumMap<>(IntegrationProvider.class);
  private final List<Lane> rotation;
  private final AtomicInteger cursor = new AtomicInteger();
  private final AtomicLong sequence = new AtomicLong();
  private final Clock clock;

  public InMemorySyncQueue(Clock clock) {
    this.clock = clock;
    for (var provider : IntegrationProvider.values()) {
      lanes.put(provider, new Lane());
    }
    this.rotation = List.copyOf(lanes.values());
  }

  @Override
  public UUID enqueue(SyncJob job) {
    var lane = lanes.get(job.provider());
    lane.lock.lock();
    try {
      var existing = lane.byInvoice.get(job.invoiceId());
      if (existing != null) {
        var merged = existing.job().mergedWith(job);
        lane.replace(existing, new QueuedJob(merged, existing.sequence()));
        log.debug(
            "Merged duplicate sync job for invoice {} into {} (priority={})",
            job.invoiceId(),
            merged.id(),
            merged.priority());
        return merged.id();
      }
      lane.add(new QueuedJob(job, sequence.incrementAndGet()));
      return job.id();
    } finally {
      lane.lock.unlock();
    }
  }

  @Override
  public Optional<SyncJob> dequeue() {
    var now = clock.instant();
    int start = Math.floorMod(cursor.getAndIncrement(), rotation.size());
    for (int i = 0; i < rotation.size(); i++) {
      var lane = rotation.get((start + i) % rotation.size());
      var job = lane.pollEligible(now);
      if (job.isPresent()) {
        return job;
      }
    }
    return Optional.empty();
  }

  @Override
  public SyncJob requeue(SyncJob job, Duration delay) {
    var next = job.retryAt(clock.instant().plus(delay));
    enqueue(next);
    return next;
  }

  @Override
  public SyncJob defer(SyncJob job, Duration delay) {
    var next = job.deferredUntil(clock.instant().plus(delay));
    enqueue(next);
    return next;
  }

  @Override
  public boolean contains(UUID invoiceId, IntegrationProvider provider) {
    var lane = lanes.get(provider);
    lane.lock.lock();
    try {
      return lane.byInvoice.containsKey(invoiceId);
    } finally {
      lane.lock.unlock();
    }
  }

  @Override
  public boolean remove(UUID invoiceId, IntegrationProvider provider) {
    var lane = lanes.get(provider);
    lane.lock.lock();
    try {
      var existing = lane.byInvoice.remove(invoiceId);
      if (existing == null) {
        return false;
      }
      lane.ordered.remove(existing);
      return true;
    } finally {
      lane.lock.unlock();
    }
  }

  @Override
  public int depth() {
    return depthByProvider().values().stream().mapToInt(Integer::intValue).sum();
  }

  @Override
  public Map<IntegrationProvider, Integer> depthByProvider() {
    var depths = new EnumMap<IntegrationProvider, Integer>(IntegrationProvider.class);
    lanes.forEach(
        (provider, lane) -> {
          lane.lock.lock();
          try {
            depths.put(provider, lane.ordered.size());
          } finally {
            lane.lock.unlock();
          }
        });
    return depths;
  }

  @Override
  public Optional<Duration> oldestJobAge() {
    Instant oldest = null;
    for (var lane : rotation) {
      lane.lock.lock();
      try {
        for (var queued : lane.ordered) {
          var enqueuedAt = queued.job().enqueuedAt();
          if (oldest == null || enqueuedAt.isBefore(oldest)) {
            oldest = enqueuedAt;
          }
        }
      } finally {
        lane.lock.unlock();
      }
    }
    return oldest == null
        ? Optional.empty()
        : Optional.of(Duration.between(oldest, clock.instant()));
  }

  private record QueuedJob(SyncJob job, long sequence) {}

  private static final class Lane {

    private final ReentrantLock lock = new ReentrantLock();
    private final TreeSet<QueuedJob> ordered = new TreeSet<>(DEQUEUE_ORDER);
    private final Map<UUID, QueuedJob> byInvoice = new HashMap<>();

    private void add(QueuedJob queued) {
      ordered.add(queued);
      byInvoice.put(queued.job().invoiceId(), queued);
    }

    private void replace(QueuedJob existing, QueuedJob replacement) {
      ordered.remove(existing);
      add(replacement);
    }

    private Optional<SyncJob> pollEligible(Instant now) {
      lock.lock();
      try {
        for (var queued : ordered) {
          if (queued.job().isEligible(now)) {
            ordered.remove(queued);
            byInvoice.remove(queued.job().invoiceId());
            return Optional.of(queued.job());
          }
        }
        return Optional.empty();
      } finally {
        lock.unlock();
      }
    }
  }
}
