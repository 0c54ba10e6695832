package org.waabox.mailrelay.spring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.waabox.mailrelay.MailRelay;
import org.waabox.mailrelay.Outcome;
import org.waabox.mailrelay.PushMetadata;
import org.waabox.mailrelay.cursor.CursorStore;
import org.waabox.mailrelay.forward.ForwardPayload;
import org.waabox.mailrelay.forward.ForwardSink;
import org.waabox.mailrelay.source.ChangeRecord;
import org.waabox.mailrelay.source.ChangeSource;
import org.waabox.mailrelay.source.TokenProvider;

/**
 * Tests for {@link MailRelayAutoConfiguration}.
 *
 * <p>Uses {@link ApplicationContextRunner} for fast, isolated testing
 * of the auto-configuration without bootstrapping a full Spring Boot
 * application.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class MailRelayAutoConfigurationTest {

  private static final Duration WAIT = Duration.ofSeconds(5);

  /** The application context runner configured with the auto-configuration. */
  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(
          AutoConfigurations.of(MailRelayAutoConfiguration.class));

  /** A mailbox with two new messages after cursor 10. */
  static class TwoMessageSource implements ChangeSource {

    @Override
    public long currentCursor(final String token) {
      return 10L;
    }

    @Override
    public List<ChangeRecord> listAddedItems(final String token,
        final long sinceCursor) {
      return List.of(new ChangeRecord("read", 11L),
          new ChangeRecord("unread", 12L));
    }

    @Override
    public Set<String> tags(final String token, final String itemId) {
      return "unread".equals(itemId)
          ? Set.of("INBOX", "UNREAD") : Set.of("INBOX");
    }
  }

  /** Records the forwarded item ids. */
  static class RecordingSink implements ForwardSink {

    private final List<String> itemIds = new CopyOnWriteArrayList<>();

    @Override
    public void forward(final ForwardPayload payload) {
      itemIds.add(payload.itemId());
    }

    List<String> itemIds() {
      return itemIds;
    }
  }

  /** An in-memory cursor store. */
  static class MapCursorStore implements CursorStore {

    private final Map<String, String> values = new ConcurrentHashMap<>();

    @Override
    public Optional<String> read(final String key) {
      return Optional.ofNullable(values.get(key));
    }

    @Override
    public void write(final String key, final String value) {
      values.put(key, value);
    }

    Map<String, String> values() {
      return values;
    }
  }

  /** Provides the required collaborators. */
  @Configuration(proxyBeanMethods = false)
  static class CollaboratorsConfig {

    @Bean
    TokenProvider tokenProvider() {
      return () -> "test-token";
    }

    @Bean
    ChangeSource changeSource() {
      return new TwoMessageSource();
    }

    @Bean
    RecordingSink forwardSink() {
      return new RecordingSink();
    }
  }

  /** Adds a cursor store. */
  @Configuration(proxyBeanMethods = false)
  static class CursorStoreConfig {

    @Bean
    MapCursorStore cursorStore() {
      return new MapCursorStore();
    }
  }

  /** Provides everything but the forward sink. */
  @Configuration(proxyBeanMethods = false)
  static class MissingSinkConfig {

    @Bean
    TokenProvider tokenProvider() {
      return () -> "test-token";
    }

    @Bean
    ChangeSource changeSource() {
      return new TwoMessageSource();
    }
  }

  @Test
  void whenContextLoads_givenNoMailbox_shouldNotCreateEngine() {
    runner.withUserConfiguration(CollaboratorsConfig.class)
        .run(context -> {
          assertFalse(context.containsBean("mailRelay"));
          assertTrue(context.getBeansOfType(MailRelay.class).isEmpty());
        });
  }

  @Test
  void whenContextLoads_givenMailboxAndCollaborators_shouldStartEngine() {
    runner.withUserConfiguration(CollaboratorsConfig.class)
        .withPropertyValues("mailrelay.mailbox=someone@example.com",
            "mailrelay.poll-interval=50ms")
        .run(context -> {
          final MailRelay relay = context.getBean(MailRelay.class);
          assertEquals("someone@example.com", relay.mailbox());

          final Outcome baseline = relay.accept(10L, PushMetadata.empty())
              .await(WAIT).orElseThrow();
          assertEquals(Outcome.Status.BASELINE_ESTABLISHED, baseline.status());

          final Outcome resolved = relay.accept(12L, PushMetadata.empty())
              .await(WAIT).orElseThrow();
          assertEquals(Outcome.Status.RESOLVED, resolved.status());
          assertEquals(List.of("read", "unread"),
              context.getBean(RecordingSink.class).itemIds());
        });
  }

  @Test
  void whenContextLoads_givenRequiredTags_shouldForwardOnlyQualifyingItems() {
    runner.withUserConfiguration(CollaboratorsConfig.class)
        .withPropertyValues("mailrelay.mailbox=someone@example.com",
            "mailrelay.poll-interval=50ms",
            "mailrelay.required-tags=INBOX,UNREAD")
        .run(context -> {
          final MailRelay relay = context.getBean(MailRelay.class);
          relay.accept(10L, PushMetadata.empty()).await(WAIT).orElseThrow();

          final Outcome outcome = relay.accept(12L, PushMetadata.empty())
              .await(WAIT).orElseThrow();

          assertEquals(1, outcome.forwarded());
          assertEquals(1, outcome.skipped());
          assertEquals(List.of("unread"),
              context.getBean(RecordingSink.class).itemIds());
        });
  }

  @Test
  void whenContextLoads_givenCursorStore_shouldPersistUnderPrefixedKey() {
    runner.withUserConfiguration(CollaboratorsConfig.class,
            CursorStoreConfig.class)
        .withPropertyValues("mailrelay.mailbox=someone@example.com",
            "mailrelay.poll-interval=50ms")
        .run(context -> {
          final MailRelay relay = context.getBean(MailRelay.class);
          relay.accept(10L, PushMetadata.empty()).await(WAIT).orElseThrow();

          assertEquals("10", context.getBean(MapCursorStore.class).values()
              .get("lastHistoryId/someone@example.com"));
        });
  }

  @Test
  void whenContextLoads_givenMissingForwardSink_shouldFailToStart() {
    runner.withUserConfiguration(MissingSinkConfig.class)
        .withPropertyValues("mailrelay.mailbox=someone@example.com")
        .run(context -> {
          final Throwable failure = context.getStartupFailure();
          assertNotNull(failure);
          Throwable cause = failure;
          while (cause.getCause() != null) {
            cause = cause.getCause();
          }
          assertTrue(cause.getMessage().contains("ForwardSink"));
        });
  }

  @Test
  void whenContextCloses_givenRunningEngine_shouldStopIt() {
    runner.withUserConfiguration(CollaboratorsConfig.class)
        .withPropertyValues("mailrelay.mailbox=someone@example.com")
        .run(context -> {
          final MailRelay relay = context.getBean(MailRelay.class);
          context.close();

          assertEquals(0, relay.status().queueDepth());
          assertThrows(IllegalStateException.class,
              () -> relay.accept(1L, PushMetadata.empty()));
        });
  }
}
