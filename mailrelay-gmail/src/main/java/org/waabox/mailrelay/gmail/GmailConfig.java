package org.waabox.mailrelay.gmail;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for {@link GmailChangeSource}.
 *
 * <p>Use the {@link #builder()} to create instances. Only the defaults of
 * the public Gmail API are assumed; every value can be overridden, which is
 * how tests point the source at a local server.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class GmailConfig {

  /** The default Gmail REST base URL. */
  private static final String DEFAULT_BASE_URL =
      "https://gmail.googleapis.com/gmail/v1";

  /** The default user id, the authenticated user. */
  private static final String DEFAULT_USER_ID = "me";

  /** The default per-call timeout. */
  private static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(10);

  /** The base URL, without trailing slash. */
  private final String baseUrl;

  /** The Gmail user id. */
  private final String userId;

  /** The optional history label filter, may be null. */
  private final String labelFilter;

  /** The per-call timeout. */
  private final Duration callTimeout;

  /**
   * Creates a new configuration from the given builder.
   *
   * @param builder the builder, never null
   */
  private GmailConfig(final Builder builder) {
    baseUrl = builder.baseUrl;
    userId = builder.userId;
    labelFilter = builder.labelFilter;
    callTimeout = builder.callTimeout;
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
   * Returns the base URL, without trailing slash.
   *
   * @return the base URL, never null
   */
  public String baseUrl() {
    return baseUrl;
  }

  /**
   * Returns the Gmail user id.
   *
   * @return the user id, never null
   */
  public String userId() {
    return userId;
  }

  /**
   * Returns the label that history listing is restricted to.
   *
   * @return the label id, or null for no restriction
   */
  public String labelFilter() {
    return labelFilter;
  }

  /**
   * Returns the per-call timeout.
   *
   * @return the timeout, never null
   */
  public Duration callTimeout() {
    return callTimeout;
  }

  /**
   * Builder for {@link GmailConfig}.
   *
   * @author waabox(waabox[at]gmail[dot]com)
   */
  public static final class Builder {

    /** The base URL. */
    private String baseUrl = DEFAULT_BASE_URL;

    /** The user id. */
    private String userId = DEFAULT_USER_ID;

    /** The label filter. */
    private String labelFilter;

    /** The per-call timeout. */
    private Duration callTimeout = DEFAULT_CALL_TIMEOUT;

    /** Private constructor; use {@link GmailConfig#builder()}. */
    private Builder() {
    }

    /**
     * Sets the base URL.
     *
     * @param theBaseUrl the base URL, never null
     * @return this builder, never null
     */
    public Builder baseUrl(final String theBaseUrl) {
      Objects.requireNonNull(theBaseUrl, "baseUrl must not be null");
      baseUrl = theBaseUrl.endsWith("/")
          ? theBaseUrl.substring(0, theBaseUrl.length() - 1)
          : theBaseUrl;
      return this;
    }

    /**
     * Sets the Gmail user id.
     *
     * @param theUserId the user id, never null
     * @return this builder, never null
     */
    public Builder userId(final String theUserId) {
      userId = Objects.requireNonNull(theUserId, "userId must not be null");
      return this;
    }

    /**
     * Restricts history listing to one label. Blank means no restriction.
     *
     * @param theLabelFilter the label id, may be null
     * @return this builder, never null
     */
    public Builder labelFilter(final String theLabelFilter) {
      labelFilter = theLabelFilter == null || theLabelFilter.isBlank()
          ? null : theLabelFilter;
      return this;
    }

    /**
     * Sets the per-call timeout.
     *
     * @param theCallTimeout the timeout, never null
     * @return this builder, never null
     */
    public Builder callTimeout(final Duration theCallTimeout) {
      callTimeout = Objects.requireNonNull(theCallTimeout,
          "callTimeout must not be null");
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return a new configuration, never null
     */
    public GmailConfig build() {
      return new GmailConfig(this);
    }
  }
}
