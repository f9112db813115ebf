package io.restoreassist.sync.integration;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** Accounting platforms an organization can push invoices to. */
public enum IntegrationProvider {
  XERO("xero"),
  QUICKBOOKS("quickbooks"),
  MYOB("myob");

  private final String slug;

  IntegrationProvider(String slug) {
    this.slug = slug;
  }

  public String getSlug() {
    return slug;
  }

  /** Resolves a URL path segment such as {@code xero}; case-insensitive. */
  public static Optional<IntegrationProvider> fromSlug(String slug) {
    if (slug == null) {
      return Optional.empty();
    }
    var normalized = slug.toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(p -> p.slug.equals(normalized)).findFirst();
  }
}
