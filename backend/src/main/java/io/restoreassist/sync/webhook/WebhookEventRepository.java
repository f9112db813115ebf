package io.restoreassist.sync.webhook;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WebhookEventRepository extends JpaRepository<WebhookEvent, UUID> {

  Optional<WebhookEvent> findByIdempotencyKey(String idempotencyKey);

  long countByStatus(WebhookEventStatus status);

  long countByStatusAndNextAttemptAtIsNull(WebhookEventStatus status);

  /**
   * Atomically moves a PENDING event, or a FAILED event whose retry is due, to PROCESSING and
   * counts the attempt. Returns 1 if this caller won the claim.
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE WebhookEvent e
         SET e.status = :processing, e.claimedAt = :now, e.attempts = e.attempts + 1,
             e.version = e.version + 1
       WHERE e.id = :id
         AND (e.status = :pending
              OR (e.status = :failed AND e.nextAttemptAt IS NOT NULL AND e.nextAttemptAt <= :now))
      """)
  int claim(
      @Param("id") UUID id,
      @Param("now") Instant now,
      @Param("processing") WebhookEventStatus processing,
      @Param("pending") WebhookEventStatus pending,
      @Param("failed") WebhookEventStatus failed);

  @Query(
      """
      SELECT e.id FROM WebhookEvent e
       WHERE e.status = :pending
          OR (e.status = :failed AND e.nextAttemptAt IS NOT NULL AND e.nextAttemptAt <= :now)
       ORDER BY e.receivedAt
      """)
  List<UUID> findDueIds(
      @Param("now") Instant now,
      @Param("pending") WebhookEventStatus pending,
      @Param("failed") WebhookEventStatus failed,
      Pageable pageable);

  /** Returns events stuck in PROCESSING since before {@code cutoff} to FAILED, due now. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE WebhookEvent e
         SET e.status = :failed, e.nextAttemptAt = :now, e.lastError = 'processing stalled',
             e.version = e.version + 1
       WHERE e.status = :processing AND e.claimedAt < :cutoff
      """)
  int releaseStalled(
      @Param("cutoff") Instant cutoff,
      @Param("now") Instant now,
      @Param("processing") WebhookEventStatus processing,
      @Param("failed") WebhookEventStatus failed);
}
