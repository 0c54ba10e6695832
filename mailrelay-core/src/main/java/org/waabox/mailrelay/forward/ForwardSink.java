package org.waabox.mailrelay.forward;

/**
 * The downstream endpoint that receives qualifying items.
 *
 * <p>The engine makes exactly one attempt per item; implementations must
 * bound the call with a timeout and must not retry on their own.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface ForwardSink {

  /**
   * Delivers one payload downstream.
   *
   * @param payload the payload to deliver, never null
   * @throws ForwardException if the delivery fails or times out
   */
  void forward(ForwardPayload payload);
}
