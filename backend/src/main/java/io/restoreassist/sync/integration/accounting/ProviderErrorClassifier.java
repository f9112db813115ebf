package io.restoreassist.sync.integration.accounting;

import io.restoreassist.sync.integration.IntegrationProvider;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Maps anything thrown by a provider call onto the {@link ProviderException} taxonomy.
 *
 * <ul>
 *   <li>429 becomes {@link RateLimitedException} honouring {@code Retry-After}
 *   <li>401 becomes {@link AuthExpiredException}
 *   <li>408 and 5xx, timeouts and I/O errors become {@link TransientProviderException}
 *   <li>any other 4xx becomes {@link PermanentProviderException}
 * </ul>
 *
 * Unrecognised exceptions are treated as transient, so they are retried a bounded number of times
 * before the invoice is failed.
 */
public final class ProviderErrorClassifier {

  static final Duration DEFAULT_RETRY_AFTER = Duration.ofSeconds(60);
  private static final int MAX_BODY_IN_MESSAGE = 300;

  private ProviderErrorClassifier() {}

  public static ProviderException classify(IntegrationProvider provider, Throwable error) {
    var cause = unwrap(error);
    if (cause instanceof ProviderException providerException) {
      return providerException;
    }
    if (cause instanceof TimeoutException) {
      return new TransientProviderException(provider, provider + " call timed out", cause);
    }
    if (cause instanceof RestClientResponseException response) {
      return classifyResponse(provider, response);
    }
    if (cause instanceof ResourceAccessException || cause instanceof IOException) {
      return new TransientProviderException(
          provider, provider + " unreachable: " + cause.getMessage(), cause);
    }
    return new TransientProviderException(
        provider, provider + " call failed: " + cause.getMessage(), cause);
  }

  private static ProviderException classifyResponse(
      IntegrationProvider provider, RestClientResponseException response) {
    int status = response.getStatusCode().value();
    var message = provider + " returned " + status + bodySnippet(response);
    if (status == 429) {
      return new RateLimitedException(provider, retryAfter(response.getResponseHeaders()));
    }
    if (status == 401) {
      return new AuthExpiredException(provider, message, response);
    }
    if (status == 408 || status >= 500) {
      return new TransientProviderException(provider, message, response);
    }
    return new PermanentProviderException(provider, message, response);
  }

  static Duration retryAfter(HttpHeaders headers) {
    if (headers == null) {
      return DEFAULT_RETRY_AFTER;
    }
    var value = headers.getFirst(HttpHeaders.RETRY_AFTER);
    if (value == null || value.isBlank()) {
      return DEFAULT_RETRY_AFTER;
    }
    try {
      long seconds = Long.parseLong(value.trim());
      return seconds > 0 ? Duration.ofSeconds(seconds) : DEFAULT_RETRY_AFTER;
    } catch (NumberFormatException e) {
      // HTTP-date form; not worth parsing for a deferral hint
      return DEFAULT_RETRY_AFTER;
    }
  }

  private static Throwable unwrap(Throwable error) {
    var current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private static String bodySnippet(RestClientResponseException response) {
    var body = response.getResponseBodyAsString();
    if (body == null || body.isBlank()) {
      return "";
    }
    var trimmed = body.strip();
    return ": "
        + (trimmed.length() > MAX_BODY_IN_MESSAGE
            ? trimmed.substring(0, MAX_BODY_IN_MESSAGE)
            : trimmed);
  }
}
