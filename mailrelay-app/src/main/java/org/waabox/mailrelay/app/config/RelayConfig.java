package org.waabox.mailrelay.app.config;

import java.net.URI;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import org.waabox.mailrelay.cursor.fs.FileSystemCursorStore;
import org.waabox.mailrelay.cursor.s3.S3CursorConfig;
import org.waabox.mailrelay.cursor.s3.S3CursorStore;
import org.waabox.mailrelay.forward.ForwardSink;
import org.waabox.mailrelay.forward.http.HttpForwardConfig;
import org.waabox.mailrelay.forward.http.HttpForwardSink;
import org.waabox.mailrelay.gmail.GmailChangeSource;
import org.waabox.mailrelay.gmail.GmailConfig;
import org.waabox.mailrelay.gmail.GoogleOAuthTokenProvider;
import org.waabox.mailrelay.gmail.StaticTokenProvider;
import org.waabox.mailrelay.source.ChangeSource;
import org.waabox.mailrelay.source.TokenProvider;
import org.waabox.mailrelay.spring.MailRelayProperties;
import software.amazon.awssdk.regions.Region;

/** Spring configuration that builds the MailRelay adapters from the
 * {@code mailrelay.*} properties.
 *
 * <p>This configuration provides the following beans that are picked up
 * by the mailrelay-spring-boot-starter auto-configuration via
 * {@link org.springframework.beans.factory.ObjectProvider}:
 * <ul>
 *   <li>a {@link TokenProvider}, refreshing OAuth tokens when a refresh
 *       token is configured, or using a fixed access token</li>
 *   <li>a {@link GmailChangeSource} reading the mailbox history</li>
 *   <li>an {@link HttpForwardSink} posting to the webhook</li>
 *   <li>a cursor store, on the filesystem or in S3, when
 *       {@code mailrelay.cursor.store} asks for one</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@Configuration
@EnableConfigurationProperties(MailRelayProperties.class)
public class RelayConfig {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      RelayConfig.class);

  /** Creates the token provider for the Gmail API.
   *
   * <p>A configured refresh token takes precedence over a fixed access
   * token, since the latter expires after an hour.
   *
   * @param properties the MailRelay properties, never null
   *
   * @return the token provider, never null
   *
   * @throws IllegalStateException if neither credential is configured
   */
  @Bean
  TokenProvider tokenProvider(final MailRelayProperties properties) {
    final MailRelayProperties.Gmail gmail = properties.getGmail();

    if (hasText(gmail.getRefreshToken())) {
      log.info("Using OAuth refresh token credentials for Gmail");
      return new GoogleOAuthTokenProvider(
          gmail.getTokenUrl(),
          gmail.getClientId(),
          gmail.getClientSecret(),
          gmail.getRefreshToken(),
          properties.getCallTimeout());
    }

    if (hasText(gmail.getAccessToken())) {
      log.info("Using a fixed access token for Gmail");
      return new StaticTokenProvider(gmail.getAccessToken());
    }

    throw new IllegalStateException("Gmail credentials missing: set"
        + " mailrelay.gmail.refresh-token (with client-id and client-secret)"
        + " or mailrelay.gmail.access-token");
  }

  /** Creates the Gmail history change source.
   *
   * @param properties the MailRelay properties, never null
   *
   * @return the change source, never null
   */
  @Bean
  ChangeSource changeSource(final MailRelayProperties properties) {
    final MailRelayProperties.Gmail gmail = properties.getGmail();

    return new GmailChangeSource(GmailConfig.builder()
        .baseUrl(gmail.getBaseUrl())
        .userId(gmail.getUserId())
        .labelFilter(gmail.getLabelFilter())
        .callTimeout(properties.getCallTimeout())
        .build());
  }

  /** Creates the webhook forward sink.
   *
   * @param properties the MailRelay properties, never null
   *
   * @return the forward sink, never null
   *
   * @throws IllegalStateException if no webhook URL is configured
   */
  @Bean
  ForwardSink forwardSink(final MailRelayProperties properties) {
    final MailRelayProperties.Forward forward = properties.getForward();

    if (!hasText(forward.getUrl())) {
      throw new IllegalStateException(
          "Webhook URL missing: set mailrelay.forward.url");
    }

    return new HttpForwardSink(HttpForwardConfig.create(forward.getUrl(),
        properties.getCallTimeout(), forward.getHeaders()));
  }

  /** Creates a cursor store that keeps one file per mailbox.
   *
   * @param properties the MailRelay properties, never null
   *
   * @return the filesystem cursor store, never null
   */
  @Bean
  @ConditionalOnProperty(prefix = "mailrelay.cursor", name = "store",
      havingValue = "fs")
  FileSystemCursorStore fileSystemCursorStore(
      final MailRelayProperties properties) {
    final Path dir = Path.of(properties.getCursor().getFs().getDir());
    log.info("Persisting cursors under {}", dir.toAbsolutePath());
    return new FileSystemCursorStore(dir);
  }

  /** Creates a cursor store that keeps one S3 object per mailbox.
   *
   * <p>The store builds and owns its S3 client, which is closed with the
   * store on shutdown. Credentials come from the AWS default provider
   * chain.
   *
   * @param properties the MailRelay properties, never null
   *
   * @return the S3 cursor store, never null
   */
  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(prefix = "mailrelay.cursor", name = "store",
      havingValue = "s3")
  S3CursorStore s3CursorStore(final MailRelayProperties properties) {
    final MailRelayProperties.Cursor.S3 s3 = properties.getCursor().getS3();

    final S3CursorConfig.Builder builder = S3CursorConfig.builder()
        .bucket(s3.getBucket())
        .region(Region.of(s3.getRegion()))
        .prefix(s3.getPrefix())
        .callTimeout(properties.getCallTimeout());

    if (hasText(s3.getEndpoint())) {
      builder.endpoint(URI.create(s3.getEndpoint()));
    }

    log.info("Persisting cursors in s3://{}/{}", s3.getBucket(),
        s3.getPrefix());
    return new S3CursorStore(builder.build());
  }

  private static boolean hasText(final String value) {
    return value != null && !value.isBlank();
  }
}
