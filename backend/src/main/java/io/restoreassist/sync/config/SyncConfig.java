package io.restoreassist.sync.config;

import io.restoreassist.sync.integration.accounting.AccountingProviderProperties;
import io.restoreassist.sync.webhook.WebhookProperties;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
  SyncProperties.class,
  WebhookProperties.class,
  AccountingProviderProperties.class
})
public class SyncConfig {

  /** Single time source for breakers, limiters, the queue and entity timestamps. */
  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }
}
