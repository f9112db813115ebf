package io.restoreassist.sync.integration.accounting;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** HTTP settings for the provider clients, bound from {@code restoreassist.accounting.*}. */
@ConfigurationProperties("restoreassist.accounting")
public record AccountingProviderProperties(
    Duration connectTimeout,
    Duration readTimeout,
    String xeroBaseUrl,
    String quickbooksBaseUrl,
    String quickbooksMinorVersion,
    String myobBaseUrl,
    String myobApiKey) {

  public AccountingProviderProperties {
    connectTimeout = connectTimeout != null ? connectTimeout : Duration.ofSeconds(5);
    readTimeout = readTimeout != null ? readTimeout : Duration.ofSeconds(25);
    xeroBaseUrl = xeroBaseUrl != null ? xeroBaseUrl : "https://api.xero.com";
    quickbooksBaseUrl =
        quickbooksBaseUrl != null ? quickbooksBaseUrl : "https://quickbooks.api.intuit.com";
    quickbooksMinorVersion = quickbooksMinorVersion != null ? quickbooksMinorVersion : "75";
    myobBaseUrl = myobBaseUrl != null ? myobBaseUrl : "https://api.myob.com/accountright";
    myobApiKey = myobApiKey != null ? myobApiKey : "";
  }

  public static AccountingProviderProperties defaults() {
    return new AccountingProviderProperties(null, null, null, null, null, null, null);
  }
}
