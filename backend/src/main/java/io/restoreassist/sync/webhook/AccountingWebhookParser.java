package io.restoreassist.sync.webhook;

import io.restoreassist.sync.integration.IntegrationProvider;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Reads the fields the event handlers need out of each provider's payload shape. Stateless; the
 * consumer re-parses the stored payload rather than persisting parsed columns.
 */
@Component
public class AccountingWebhookParser {

  private final ObjectMapper objectMapper;

  public AccountingWebhookParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * @throws WebhookPayloadException if the body is not a JSON object or has no event type
   */
  public ParsedWebhookEvent parse(IntegrationProvider provider, String payload) {
    JsonNode root;
    try {
      root = objectMapper.readTree(payload);
    } catch (JacksonException e) {
      throw WebhookPayloadException.malformed("Malformed JSON payload", e);
    }
    if (root == null || !root.isObject()) {
      throw WebhookPayloadException.malformed("Webhook payload must be a JSON object", null);
    }

    var eventType = eventType(provider, root);
    if (eventType == null) {
      throw WebhookPayloadException.missing("eventType", "Webhook payload has no event type");
    }

    return switch (provider) {
      case XERO ->
          new ParsedWebhookEvent(
              text(root.path("eventId")),
              eventType,
              text(root.path("resourceId")),
              firstText(root.path("paymentId"), root.path("resourceId")),
              amount(root.path("Amount")),
              date(root.path("eventDateUtc")),
              text(root.path("Reference")));
      case QUICKBOOKS ->
          new ParsedWebhookEvent(
              text(root.path("eventId")),
              eventType,
              quickBooksInvoiceId(eventType, root),
              text(root.path("Id")),
              amount(root.path("TotalAmt")),
              date(root.path("TxnDate")),
              text(root.path("PaymentRefNum")));
      case MYOB ->
          new ParsedWebhookEvent(
              text(root.path("eventId")),
              eventType,
              firstText(root.path("InvoiceUID"), root.path("ResourceUID")),
              text(root.path("UID")),
              amount(root.path("Amount")),
              date(root.path("Date")),
              text(root.path("Memo")));
    };
  }

  /**
   * Uses {@code eventType} when it is already dotted ({@code invoice.paid}); Xero's
   * category/verb form ({@code PAYMENT}/{@code CREATE}) is folded into the same vocabulary.
   */
  private static String eventType(IntegrationProvider provider, JsonNode root) {
    var type = text(root.path("eventType"));
    if (type != null && type.contains(".")) {
      return type.toLowerCase(Locale.ROOT);
    }
    var category = text(root.path("eventCategory"));
    if (provider == IntegrationProvider.XERO && type != null && category != null) {
      return category.toLowerCase(Locale.ROOT) + "." + pastTense(type.toLowerCase(Locale.ROOT));
    }
    return type != null ? type.toLowerCase(Locale.ROOT) : null;
  }

  private static String pastTense(String verb) {
    return verb.endsWith("e") ? verb + "d" : verb + "ed";
  }

  /** Payments link the invoice through LinkedTxn; invoice events carry their own Id. */
  private static String quickBooksInvoiceId(String eventType, JsonNode root) {
    if (eventType.startsWith("invoice.") && !"invoice.paid".equals(eventType)) {
      return firstText(root.path("Id"), root.path("id"));
    }
    return firstText(
        root.path("Line").path(0).path("LinkedTxn").path(0).path("TxnId"),
        root.path("LinkedTxn").path(0).path("TxnId"));
  }

  private static String text(JsonNode node) {
    if (node.isMissingNode() || node.isNull()) {
      return null;
    }
    var value = node.asText();
    return value.isBlank() ? null : value;
  }

  private static String firstText(JsonNode first, JsonNode second) {
    var value = text(first);
    return value != null ? value : text(second);
  }

  private static BigDecimal amount(JsonNode node) {
    var value = text(node);
    if (value == null) {
      return null;
    }
    try {
      return new BigDecimal(value);
    } catch (NumberFormatException e) {
      throw WebhookPayloadException.invalid("amount", value);
    }
  }

  /** Accepts a plain date or an ISO timestamp with offset; anything else is treated as absent. */
  private static LocalDate date(JsonNode node) {
    var value = text(node);
    if (value == null) {
      return null;
    }
    try {
      return value.length() == 10
          ? LocalDate.parse(value)
          : OffsetDateTime.parse(value).toLocalDate();
    } catch (DateTimeParseException e) {
      return null;
    }
  }
}
