package io.restoreassist.sync.webhook;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.resilience4j.core.IntervalFunction;
import io.restoreassist.sync.integration.IntegrationProvider;
import io.restoreassist.sync.testutil.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import tools.jackson.databind.ObjectMapper;

class WebhookEventProcessorTest {

  private static final int MAX_ATTEMPTS = 5;
  private static final String PAYMENT_PAYLOAD =
      """
      {"eventId":"m-1","eventType":"invoice.paid","InvoiceUID":"uid-inv","UID":"uid-pay",
       "Amount":"55.00"}
      """;

  private WebhookEventRepository repository;
  private WebhookEventHandler handler;
  private MutableClock clock;
  private WebhookEventProcessor processor;

  @BeforeEach
  void setUp() {
    repository = mock(WebhookEventRepository.class);
    handler = mock(WebhookEventHandler.class);
    clock = MutableClock.startingAt("2025-05-06T10:00:00Z");
    processor =
        new WebhookEventProcessor(
            repository,
            new AccountingWebhookParser(new ObjectMapper()),
            handler,
            new TransactionTemplate(mock(PlatformTransactionManager.class)),
            IntervalFunction.ofExponentialBackoff(Duration.ofSeconds(30), 2.0, Duration.ofHours(1)),
            MAX_ATTEMPTS,
            clock);
  }

  @Test
  void process_handledEventIsMarkedProcessed() {
    var event = claimedEvent(PAYMENT_PAYLOAD, 1);
    when(handler.handle(eq(event), any())).thenReturn(true);

    var status = processor.process(event.getId());

    assertThat(status).isEqualTo(WebhookEventStatus.PROCESSED);
    assertThat(event.getProcessedAt()).isEqualTo(clock.instant());
    verify(repository).save(event);
  }

  @Test
  void process_unsupportedEventIsSkippedWithReason() {
    var event = claimedEvent("{\"eventType\":\"item.created\"}", 1);
    when(handler.handle(eq(event), any())).thenReturn(false);

    var status = processor.process(event.getId());

    assertThat(status).isEqualTo(WebhookEventStatus.SKIPPED);
    assertThat(event.getLastError()).isEqualTo("Unsupported event type: item.created");
  }

  @Test
  void process_eventHeldByAnotherConsumerIsLeftAlone() {
    var event = newEvent(PAYMENT_PAYLOAD);
    when(repository.claim(
            eq(event.getId()),
            any(Instant.class),
            eq(WebhookEventStatus.PROCESSING),
            eq(WebhookEventStatus.PENDING),
            eq(WebhookEventStatus.FAILED)))
        .thenReturn(0);

    assertThat(processor.process(event.getId())).isNull();
    verify(handler, never()).handle(any(), any());
  }

  @Test
  void process_handlerFailureSchedulesRetryWithBackoff() {
    var event = claimedEvent(PAYMENT_PAYLOAD, 2);
    when(handler.handle(eq(event), any())).thenThrow(new IllegalStateException("db hiccup"));

    var status = processor.process(event.getId());

    assertThat(status).isEqualTo(WebhookEventStatus.FAILED);
    assertThat(event.getStatus()).isEqualTo(WebhookEventStatus.FAILED);
    assertThat(event.getLastError()).isEqualTo("db hiccup");
    assertThat(event.getNextAttemptAt()).isEqualTo(clock.instant().plusSeconds(60));
    assertThat(event.isDeadLettered()).isFalse();
  }

  @Test
  void process_lastAttemptFailureDeadLetters() {
    var event = claimedEvent(PAYMENT_PAYLOAD, MAX_ATTEMPTS);
    when(handler.handle(eq(event), any())).thenThrow(new IllegalStateException("still broken"));

    processor.process(event.getId());

    assertThat(event.isDeadLettered()).isTrue();
    assertThat(event.getNextAttemptAt()).isNull();
  }

  @Test
  void process_unreadableStoredPayloadIsDeadLetteredOnFirstAttempt() {
    var event = claimedEvent("{\"UID\":\"no type\"}", 1);

    var status = processor.process(event.getId());

    assertThat(status).isEqualTo(WebhookEventStatus.FAILED);
    assertThat(event.getLastError()).contains("event type");
    assertThat(event.isDeadLettered()).isTrue();
    verify(handler, never()).handle(any(), any());
  }

  @Test
  void process_paymentWithoutInvoiceReferenceIsDeadLetteredWithoutRetry() {
    var event = claimedEvent(PAYMENT_PAYLOAD, 1);
    when(handler.handle(eq(event), any()))
        .thenThrow(
            WebhookPayloadException.missing(
                "externalInvoiceId", "Payment event has no invoice reference"));

    var status = processor.process(event.getId());

    assertThat(status).isEqualTo(WebhookEventStatus.FAILED);
    assertThat(event.isDeadLettered()).isTrue();
    assertThat(event.getAttempts()).isEqualTo(1);
    assertThat(event.getLastError()).isEqualTo("Payment event has no invoice reference");
  }

  private WebhookEvent newEvent(String payload) {
    return new WebhookEvent(
        IntegrationProvider.MYOB, "myob:m-1", "invoice.paid", "m-1", payload, clock.instant());
  }

  /** Stubs a won claim; {@code attempts} mirrors the counter the claim update leaves behind. */
  private WebhookEvent claimedEvent(String payload, int attempts) {
    var event = newEvent(payload);
    ReflectionTestUtils.setField(event, "attempts", attempts);
    when(repository.claim(
            eq(event.getId()),
            any(Instant.class),
            eq(WebhookEventStatus.PROCESSING),
            eq(WebhookEventStatus.PENDING),
            eq(WebhookEventStatus.FAILED)))
        .thenReturn(1);
    when(repository.findById(event.getId())).thenReturn(Optional.of(event));
    return event;
  }
}
