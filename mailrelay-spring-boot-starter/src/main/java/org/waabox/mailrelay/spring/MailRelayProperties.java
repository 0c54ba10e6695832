package org.waabox.mailrelay.spring;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for MailRelay, mapped from the
 * {@code mailrelay.*} prefix in application.yml or application.properties.
 *
 * <p>The top-level values configure the engine itself. The nested groups
 * configure the intake endpoint, the Gmail adapters, the webhook and the
 * cursor store; they are read by whoever builds those collaborators.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "mailrelay")
public class MailRelayProperties {

  /** The mailbox served by the engine, also the cursor store key. */
  private String mailbox;

  /** The maximum number of queued notifications. */
  private int maxQueueLength = 1000;

  /** How long the worker waits for work before re-checking for stop. */
  private Duration pollInterval = Duration.ofSeconds(1);

  /** The timeout of each outbound call. */
  private Duration callTimeout = Duration.ofSeconds(10);

  /** Labels an item must carry to be forwarded; empty forwards all. */
  private List<String> requiredTags = new ArrayList<>();

  /** The intake endpoint settings. */
  private final Intake intake = new Intake();

  /** The Gmail adapter settings. */
  private final Gmail gmail = new Gmail();

  /** The webhook settings. */
  private final Forward forward = new Forward();

  /** The cursor store settings. */
  private final Cursor cursor = new Cursor();

  /**
   * Returns the mailbox.
   *
   * @return the mailbox, may be null when not configured
   */
  public String getMailbox() {
    return mailbox;
  }

  /**
   * Sets the mailbox.
   *
   * @param mailbox the mailbox
   */
  public void setMailbox(final String mailbox) {
    this.mailbox = mailbox;
  }

  /**
   * Returns the maximum queue length.
   *
   * @return the maximum queue length
   */
  public int getMaxQueueLength() {
    return maxQueueLength;
  }

  /**
   * Sets the maximum queue length.
   *
   * @param maxQueueLength the maximum queue length
   */
  public void setMaxQueueLength(final int maxQueueLength) {
    this.maxQueueLength = maxQueueLength;
  }

  /**
   * Returns the worker poll interval.
   *
   * @return the poll interval, never null
   */
  public Duration getPollInterval() {
    return pollInterval;
  }

  /**
   * Sets the worker poll interval.
   *
   * @param pollInterval the poll interval
   */
  public void setPollInterval(final Duration pollInterval) {
    this.pollInterval = pollInterval;
  }

  /**
   * Returns the per-call timeout.
   *
   * @return the timeout, never null
   */
  public Duration getCallTimeout() {
    return callTimeout;
  }

  /**
   * Sets the per-call timeout.
   *
   * @param callTimeout the timeout
   */
  public void setCallTimeout(final Duration callTimeout) {
    this.callTimeout = callTimeout;
  }

  /**
   * Returns the labels an item must carry to be forwarded.
   *
   * @return the labels, never null
   */
  public List<String> getRequiredTags() {
    return requiredTags;
  }

  /**
   * Sets the labels an item must carry to be forwarded.
   *
   * @param requiredTags the labels
   */
  public void setRequiredTags(final List<String> requiredTags) {
    this.requiredTags = requiredTags;
  }

  /**
   * Returns the intake settings.
   *
   * @return the intake settings, never null
   */
  public Intake getIntake() {
    return intake;
  }

  /**
   * Returns the Gmail settings.
   *
   * @return the Gmail settings, never null
   */
  public Gmail getGmail() {
    return gmail;
  }

  /**
   * Returns the webhook settings.
   *
   * @return the webhook settings, never null
   */
  public Forward getForward() {
    return forward;
  }

  /**
   * Returns the cursor store settings.
   *
   * @return the cursor store settings, never null
   */
  public Cursor getCursor() {
    return cursor;
  }

  /** Intake endpoint settings. */
  public static class Intake {

    /** The path the push source posts to. */
    private String path = "/";

    /** How long a push request waits for its outcome. */
    private Duration responseTimeout = Duration.ofSeconds(25);

    public String getPath() {
      return path;
    }

    public void setPath(final String path) {
      this.path = path;
    }

    public Duration getResponseTimeout() {
      return responseTimeout;
    }

    public void setResponseTimeout(final Duration responseTimeout) {
      this.responseTimeout = responseTimeout;
    }
  }

  /**
   * Gmail adapter settings.
   *
   * <p>Either {@code refresh-token} (with client id and secret) or a fixed
   * {@code access-token} must be set.
   */
  public static class Gmail {

    private String baseUrl = "https://gmail.googleapis.com/gmail/v1";

    private String userId = "me";

    private String labelFilter;

    private String tokenUrl = "https://oauth2.googleapis.com/token";

    private String clientId;

    private String clientSecret;

    private String refreshToken;

    private String accessToken;

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(final String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public String getUserId() {
      return userId;
    }

    public void setUserId(final String userId) {
      this.userId = userId;
    }

    public String getLabelFilter() {
      return labelFilter;
    }

    public void setLabelFilter(final String labelFilter) {
      this.labelFilter = labelFilter;
    }

    public String getTokenUrl() {
      return tokenUrl;
    }

    public void setTokenUrl(final String tokenUrl) {
      this.tokenUrl = tokenUrl;
    }

    public String getClientId() {
      return clientId;
    }

    public void setClientId(final String clientId) {
      this.clientId = clientId;
    }

    public String getClientSecret() {
      return clientSecret;
    }

    public void setClientSecret(final String clientSecret) {
      this.clientSecret = clientSecret;
    }

    public String getRefreshToken() {
      return refreshToken;
    }

    public void setRefreshToken(final String refreshToken) {
      this.refreshToken = refreshToken;
    }

    public String getAccessToken() {
      return accessToken;
    }

    public void setAccessToken(final String accessToken) {
      this.accessToken = accessToken;
    }
  }

  /** Webhook settings. */
  public static class Forward {

    /** The webhook URL. */
    private String url;

    /** Headers added to every forward request. */
    private Map<String, String> headers = new LinkedHashMap<>();

    public String getUrl() {
      return url;
    }

    public void setUrl(final String url) {
      this.url = url;
    }

    public Map<String, String> getHeaders() {
      return headers;
    }

    public void setHeaders(final Map<String, String> headers) {
      this.headers = headers;
    }
  }

  /** Cursor store settings. */
  public static class Cursor {

    /** The store kind: {@code none}, {@code fs} or {@code s3}. */
    private String store = "none";

    /** Prepended to the mailbox to form the store key. */
    private String keyPrefix = "lastHistoryId/";

    private final Fs fs = new Fs();

    private final S3 s3 = new S3();

    public String getStore() {
      return store;
    }

    public void setStore(final String store) {
      this.store = store;
    }

    public String getKeyPrefix() {
      return keyPrefix;
    }

    public void setKeyPrefix(final String keyPrefix) {
      this.keyPrefix = keyPrefix;
    }

    public Fs getFs() {
      return fs;
    }

    public S3 getS3() {
      return s3;
    }

    /** Filesystem store settings. */
    public static class Fs {

      private String dir = "./data/cursors";

      public String getDir() {
        return dir;
      }

      public void setDir(final String dir) {
        this.dir = dir;
      }
    }

    /** S3 store settings. */
    public static class S3 {

      private String bucket;

      private String region = "us-east-1";

      private String endpoint;

      private String prefix = "mailrelay/";

      public String getBucket() {
        return bucket;
      }

      public void setBucket(final String bucket) {
        this.bucket = bucket;
      }

      public String getRegion() {
        return region;
      }

      public void setRegion(final String region) {
        this.region = region;
      }

      public String getEndpoint() {
        return endpoint;
      }

      public void setEndpoint(final String endpoint) {
        this.endpoint = endpoint;
      }

      public String getPrefix() {
        return prefix;
      }

      public void setPrefix(final String prefix) {
        this.prefix = prefix;
      }
    }
  }
}
