package io.b2mash.b2b.einvoice.config;

import io.b2mash.b2b.einvoice.authority.AuthorityCredentials;
import io.b2mash.b2b.einvoice.authority.AuthorityProperties;
import io.b2mash.b2b.einvoice.support.TimeBoundedExecutor;
import io.b2mash.b2b.einvoice.verification.VerificationProperties;
import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({AuthorityProperties.class, VerificationProperties.class})
public class AuthorityConfig {

  private static final Logger log = LoggerFactory.getLogger(AuthorityConfig.class);

  /** Read once at startup; shared read-only for the lifetime of the process. */
  @Bean
  AuthorityCredentials authorityCredentials(AuthorityProperties properties) {
    var credentials = properties.toCredentials();
    log.info(
        "Authority configured: mode={}, environment={}, endpoint={}, salesPoint={}",
        properties.mode(),
        credentials.environment(),
        credentials.endpoint(),
        credentials.salesPoint());
    return credentials;
  }

  @Bean
  @ConditionalOnMissingBean
  Clock clock() {
    return Clock.systemDefaultZone();
  }

  @Bean(destroyMethod = "close")
  TimeBoundedExecutor authorityCallExecutor() {
    var counter = new AtomicInteger();
    ThreadFactory threadFactory =
        runnable -> {
          var thread = new Thread(runnable, "authority-call-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    return new TimeBoundedExecutor(Executors.newCachedThreadPool(threadFactory));
  }
}
