package org.waabox.mailrelay.cursor.s3;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * Configuration for {@link S3CursorStore}.
 *
 * <p>Use the {@link #builder()} to create instances. The bucket and region
 * are required. An {@link S3Client} may be supplied; otherwise the store
 * builds its own from the region, the optional endpoint override and the
 * call timeout.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class S3CursorConfig {

  /** The default key prefix. */
  private static final String DEFAULT_PREFIX = "mailrelay/";

  /** The default timeout of each S3 call. */
  private static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(10);

  /** The S3 bucket name. */
  private final String bucket;

  /** The key prefix within the bucket. */
  private final String prefix;

  /** The AWS region. */
  private final Region region;

  /** The endpoint override for S3-compatible services, may be null. */
  private final URI endpoint;

  /** The timeout of each S3 call. */
  private final Duration callTimeout;

  /** The caller-owned client, may be null. */
  private final S3Client s3Client;

  /**
   * Creates a new configuration from the given builder.
   *
   * @param builder the builder, never null
   */
  private S3CursorConfig(final Builder builder) {
    this.bucket = Objects.requireNonNull(builder.bucket,
        "bucket must not be null");
    this.region = Objects.requireNonNull(builder.region,
        "region must not be null");
    this.prefix = builder.prefix != null ? builder.prefix : DEFAULT_PREFIX;
    this.endpoint = builder.endpoint;
    this.callTimeout = builder.callTimeout != null
        ? builder.callTimeout : DEFAULT_CALL_TIMEOUT;
    this.s3Client = builder.s3Client;
  }

  /**
   * Returns the bucket name.
   *
   * @return the bucket, never null
   */
  public String bucket() {
    return bucket;
  }

  /**
   * Returns the key prefix.
   *
   * @return the prefix, never null
   */
  public String prefix() {
    return prefix;
  }

  /**
   * Returns the region.
   *
   * @return the region, never null
   */
  public Region region() {
    return region;
  }

  /**
   * Returns the endpoint override.
   *
   * @return the endpoint, or empty for the AWS default
   */
  public Optional<URI> endpoint() {
    return Optional.ofNullable(endpoint);
  }

  /**
   * Returns the timeout of each S3 call made by a store-owned client.
   *
   * @return the timeout, never null
   */
  public Duration callTimeout() {
    return callTimeout;
  }

  /**
   * Returns the caller-owned client.
   *
   * @return the client, or empty if the store builds its own
   */
  public Optional<S3Client> s3Client() {
    return Optional.ofNullable(s3Client);
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for {@link S3CursorConfig}.
   *
   * @author waabox(waabox[at]gmail[dot]com)
   */
  public static final class Builder {

    /** The bucket. */
    private String bucket;

    /** The prefix. */
    private String prefix;

    /** The region. */
    private Region region;

    /** The endpoint override. */
    private URI endpoint;

    /** The call timeout. */
    private Duration callTimeout;

    /** The client. */
    private S3Client s3Client;

    /** Private constructor; use {@link S3CursorConfig#builder()}. */
    private Builder() {
    }

    /**
     * Sets the bucket.
     *
     * @param theBucket the bucket, never null
     * @return this builder, never null
     */
    public Builder bucket(final String theBucket) {
      this.bucket = theBucket;
      return this;
    }

    /**
     * Sets the key prefix.
     *
     * @param thePrefix the prefix, null for the default
     * @return this builder, never null
     */
    public Builder prefix(final String thePrefix) {
      this.prefix = thePrefix;
      return this;
    }

    /**
     * Sets the region.
     *
     * @param theRegion the region, never null
     * @return this builder, never null
     */
    public Builder region(final Region theRegion) {
      this.region = theRegion;
      return this;
    }

    /**
     * Points a store-owned client at an S3-compatible endpoint.
     *
     * @param theEndpoint the endpoint, may be null
     * @return this builder, never null
     */
    public Builder endpoint(final URI theEndpoint) {
      this.endpoint = theEndpoint;
      return this;
    }

    /**
     * Sets the timeout of each call made by a store-owned client.
     *
     * @param theCallTimeout the timeout, null for the default
     * @return this builder, never null
     */
    public Builder callTimeout(final Duration theCallTimeout) {
      this.callTimeout = theCallTimeout;
      return this;
    }

    /**
     * Sets a caller-owned client.
     *
     * @param theS3Client the client, may be null
     * @return this builder, never null
     */
    public Builder s3Client(final S3Client theS3Client) {
      this.s3Client = theS3Client;
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return a new configuration, never null
     */
    public S3CursorConfig build() {
      return new S3CursorConfig(this);
    }
  }
}
