package org.waabox.mailrelay;

import java.util.Map;

/**
 * Provenance of a push notification, copied verbatim from the delivery
 * envelope so it can be echoed downstream with every forwarded item.
 *
 * @param mailbox      the mailbox address reported by the push source, may
 *                     be null when the source omits it
 * @param messageId    the push message identifier, may be null
 * @param publishTime  the publish time reported by the push source, may be
 *                     null
 * @param subscription the subscription that delivered the message, may be
 *                     null
 * @param rawData      the base64 payload exactly as received, may be null
 * @param headers      the request headers of the delivery, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record PushMetadata(
    String mailbox,
    String messageId,
    String publishTime,
    String subscription,
    String rawData,
    Map<String, String> headers
) {

  /** Copies the headers into an unmodifiable map. */
  public PushMetadata {
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }

  /**
   * Creates metadata that carries no provenance at all.
   *
   * @return an empty metadata instance, never null
   */
  public static PushMetadata empty() {
    return new PushMetadata(null, null, null, null, null, Map.of());
  }
}
