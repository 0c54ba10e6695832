package org.waabox.mailrelay.source;

/**
 * Supplies the short-lived bearer token used to call the
 * {@link ChangeSource}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface TokenProvider {

  /**
   * Returns a valid bearer token.
   *
   * @return the token, never null
   * @throws TokenAcquisitionException if no token can be obtained
   */
  String token();
}
