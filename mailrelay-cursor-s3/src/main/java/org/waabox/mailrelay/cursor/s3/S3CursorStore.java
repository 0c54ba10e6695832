package org.waabox.mailrelay.cursor.s3;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.mailrelay.cursor.CursorStore;
import org.waabox.mailrelay.cursor.CursorStoreException;

import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * A {@link CursorStore} implementation that keeps each value in its own
 * small Amazon S3 object at {@code {prefix}{key}}.
 *
 * <p>When an {@link S3Client} is not provided via the config, this store
 * creates one from the configured region, endpoint and call timeout. In
 * that case, the client is closed when {@link #close()} is called.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class S3CursorStore implements CursorStore, AutoCloseable {

  /** Logger for this class. */
  private static final Logger log =
      LoggerFactory.getLogger(S3CursorStore.class);

  /** The S3 bucket name. */
  private final String bucket;

  /** The key prefix within the bucket. */
  private final String prefix;

  /** The S3 client used for all operations. */
  private final S3Client s3Client;

  /** Whether this store owns the S3 client and should close it. */
  private final boolean ownsClient;

  /**
   * Creates a new S3CursorStore from the given configuration.
   *
   * @param config the configuration, never null
   *
   * @throws NullPointerException if config is null
   */
  public S3CursorStore(final S3CursorConfig config) {
    Objects.requireNonNull(config, "config must not be null");

    this.bucket = config.bucket();
    this.prefix = config.prefix();

    if (config.s3Client().isPresent()) {
      this.s3Client = config.s3Client().get();
      this.ownsClient = false;
    } else {
      final S3ClientBuilder builder = S3Client.builder()
          .region(config.region())
          .overrideConfiguration(ClientOverrideConfiguration.builder()
              .apiCallTimeout(config.callTimeout())
              .build());
      config.endpoint().ifPresent(endpoint -> builder
          .endpointOverride(endpoint)
          .forcePathStyle(true));
      this.s3Client = builder.build();
      this.ownsClient = true;
    }
  }

  /** {@inheritDoc} */
  @Override
  public Optional<String> read(final String key) {
    final String objectKey = buildKey(key);

    final GetObjectRequest request = GetObjectRequest.builder()
        .bucket(bucket)
        .key(objectKey)
        .build();

    try (ResponseInputStream<GetObjectResponse> response =
             s3Client.getObject(request)) {

      final String value = new String(response.readAllBytes(),
          StandardCharsets.UTF_8).trim();
      log.debug("Read cursor '{}' from s3://{}/{}", value, bucket,
          objectKey);
      return Optional.of(value);

    } catch (final NoSuchKeyException e) {
      log.debug("No cursor found at s3://{}/{}", bucket, objectKey);
      return Optional.empty();

    } catch (final IOException | SdkException e) {
      throw new CursorStoreException("Failed to read cursor from s3://"
          + bucket + "/" + objectKey, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void write(final String key, final String value) {
    Objects.requireNonNull(value, "value must not be null");

    final String objectKey = buildKey(key);

    final PutObjectRequest request = PutObjectRequest.builder()
        .bucket(bucket)
        .key(objectKey)
        .contentType("text/plain")
        .build();

    try {
      s3Client.putObject(request, RequestBody.fromString(value,
          StandardCharsets.UTF_8));
    } catch (final SdkException e) {
      throw new CursorStoreException("Failed to write cursor to s3://"
          + bucket + "/" + objectKey, e);
    }

    log.debug("Wrote cursor '{}' to s3://{}/{}", value, bucket, objectKey);
  }

  /**
   * Closes the S3 client if this store created it.
   */
  @Override
  public void close() {
    if (ownsClient) {
      log.debug("Closing S3 client owned by this store");
      s3Client.close();
    }
  }

  /**
   * Builds the S3 object key for a store key.
   *
   * @param key the store key, never null
   * @return the full S3 object key, never null
   */
  private String buildKey(final String key) {
    Objects.requireNonNull(key, "key must not be null");
    return prefix + key;
  }
}
