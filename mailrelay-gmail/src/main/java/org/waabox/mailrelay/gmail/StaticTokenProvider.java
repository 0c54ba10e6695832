package org.waabox.mailrelay.gmail;

import java.util.Objects;

import org.waabox.mailrelay.source.TokenProvider;

/**
 * A {@link TokenProvider} that always returns the same, externally
 * obtained access token.
 *
 * <p>Suited to short-lived deployments and tests; the token is never
 * refreshed.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class StaticTokenProvider implements TokenProvider {

  /** The access token. */
  private final String accessToken;

  /**
   * Creates a new provider.
   *
   * @param theAccessToken the access token, never null or blank
   */
  public StaticTokenProvider(final String theAccessToken) {
    Objects.requireNonNull(theAccessToken, "accessToken must not be null");
    if (theAccessToken.isBlank()) {
      throw new IllegalArgumentException("accessToken must not be blank");
    }
    accessToken = theAccessToken;
  }

  /** {@inheritDoc} */
  @Override
  public String token() {
    return accessToken;
  }
}
