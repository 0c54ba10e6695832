package org.waabox.mailrelay.spring;

import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.waabox.mailrelay.MailRelay;
import org.waabox.mailrelay.TagPredicate;
import org.waabox.mailrelay.cursor.CursorStore;
import org.waabox.mailrelay.forward.ForwardSink;
import org.waabox.mailrelay.metrics.MailRelayMetrics;
import org.waabox.mailrelay.source.ChangeSource;
import org.waabox.mailrelay.source.TokenProvider;

/**
 * Spring Boot auto-configuration for the MailRelay engine.
 *
 * <p>Active when {@code mailrelay.mailbox} is set. This configuration
 * creates and manages a singleton {@link MailRelay}, wiring the required
 * {@link TokenProvider}, {@link ChangeSource} and {@link ForwardSink} beans
 * and the optional {@link CursorStore} and {@link MailRelayMetrics} beans
 * found in the application context.
 *
 * <p>The engine's worker is started and stopped through Spring's
 * {@link SmartLifecycle}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "mailrelay", name = "mailbox")
@EnableConfigurationProperties(MailRelayProperties.class)
public class MailRelayAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      MailRelayAutoConfiguration.class);

  /**
   * Creates the singleton {@link MailRelay} bean.
   *
   * @param properties            the configuration properties, never null
   * @param tokenProviderProvider provider for the TokenProvider bean
   * @param changeSourceProvider  provider for the ChangeSource bean
   * @param forwardSinkProvider   provider for the ForwardSink bean
   * @param cursorStoreProvider   provider for an optional CursorStore bean
   * @param metricsProvider       provider for an optional MailRelayMetrics
   *                              bean
   *
   * @return the configured engine, never null
   *
   * @throws IllegalStateException if a required collaborator is missing or
   *                               ambiguous
   */
  @Bean
  @ConditionalOnMissingBean
  public MailRelay mailRelay(
      final MailRelayProperties properties,
      final ObjectProvider<TokenProvider> tokenProviderProvider,
      final ObjectProvider<ChangeSource> changeSourceProvider,
      final ObjectProvider<ForwardSink> forwardSinkProvider,
      final ObjectProvider<CursorStore> cursorStoreProvider,
      final ObjectProvider<MailRelayMetrics> metricsProvider) {

    requireAtMostOne(cursorStoreProvider, CursorStore.class);
    requireAtMostOne(metricsProvider, MailRelayMetrics.class);

    final MailRelay.Builder builder = MailRelay.builder()
        .mailbox(properties.getMailbox())
        .tokenProvider(requireOne(tokenProviderProvider, TokenProvider.class))
        .changeSource(requireOne(changeSourceProvider, ChangeSource.class))
        .forwardSink(requireOne(forwardSinkProvider, ForwardSink.class))
        .maxQueueLength(properties.getMaxQueueLength())
        .pollInterval(properties.getPollInterval())
        .cursorKeyPrefix(properties.getCursor().getKeyPrefix());

    final List<String> requiredTags = properties.getRequiredTags();
    if (requiredTags != null && !requiredTags.isEmpty()) {
      builder.tagPredicate(TagPredicate.requireAll(requiredTags));
      log.info("MailRelay forwarding items tagged with all of {}",
          requiredTags);
    } else {
      log.info("MailRelay forwarding every new item");
    }

    cursorStoreProvider.ifAvailable(store -> {
      builder.cursorStore(store);
      log.info("MailRelay using CursorStore: {}",
          store.getClass().getSimpleName());
    });

    metricsProvider.ifAvailable(metrics -> {
      builder.metrics(metrics);
      log.info("MailRelay using custom MailRelayMetrics: {}",
          metrics.getClass().getSimpleName());
    });

    final MailRelay relay = builder.build();

    log.info("MailRelay created for mailbox '{}' (max queue length {})",
        relay.mailbox(), properties.getMaxQueueLength());

    return relay;
  }

  /**
   * Creates a {@link SmartLifecycle} bean that starts and stops the
   * engine's worker.
   *
   * <p>The lifecycle starts late (phase {@code Integer.MAX_VALUE - 1}) so
   * the adapters are ready first, and stops early for the same reason.
   *
   * @param relay the engine to manage, never null
   *
   * @return the lifecycle bean, never null
   */
  @Bean
  public SmartLifecycle mailRelayLifecycle(final MailRelay relay) {
    return new SmartLifecycle() {

      /** Whether the lifecycle is currently running. */
      private volatile boolean running = false;

      @Override
      public void start() {
        relay.start();
        running = true;
        log.info("MailRelay lifecycle started for mailbox '{}'",
            relay.mailbox());
      }

      @Override
      public void stop() {
        relay.stop();
        running = false;
        log.info("MailRelay lifecycle stopped for mailbox '{}'",
            relay.mailbox());
      }

      @Override
      public boolean isRunning() {
        return running;
      }

      @Override
      public int getPhase() {
        return Integer.MAX_VALUE - 1;
      }
    };
  }

  /**
   * Returns the single bean of the given type.
   *
   * @param provider the object provider, never null
   * @param type     the bean type for error reporting, never null
   * @param <T>      the bean type
   *
   * @return the bean, never null
   *
   * @throws IllegalStateException if there is no bean, or more than one
   */
  private <T> T requireOne(final ObjectProvider<T> provider,
      final Class<T> type) {
    requireAtMostOne(provider, type);
    final T bean = provider.getIfAvailable();
    if (bean == null) {
      throw new IllegalStateException("MailRelay requires a "
          + type.getSimpleName() + " bean, but none was found");
    }
    return bean;
  }

  /**
   * Validates that at most one bean of the given type is present in the
   * application context.
   *
   * @param provider the object provider to validate, never null
   * @param type     the bean type for error reporting, never null
   * @param <T>      the bean type
   *
   * @throws IllegalStateException if more than one bean of the given type
   *                               is present
   */
  private <T> void requireAtMostOne(final ObjectProvider<T> provider,
      final Class<T> type) {

    final List<String> beanNames = provider.orderedStream()
        .map(bean -> bean.getClass().getSimpleName())
        .collect(Collectors.toList());

    if (beanNames.size() > 1) {
      throw new IllegalStateException(
          "MailRelay requires at most one " + type.getSimpleName()
              + " bean, but found " + beanNames.size() + ": "
              + String.join(", ", beanNames));
    }
  }
}
