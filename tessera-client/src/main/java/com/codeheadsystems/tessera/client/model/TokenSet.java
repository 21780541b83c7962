package com.codeheadsystems.tessera.client.model;

import com.codeheadsystems.tessera.model.token.TokenResponse;
import java.time.Instant;
import java.util.Objects;

/**
 * The current session's tokens. Replaced wholesale on every exchange or refresh.
 *
 * @param accessToken      the access token
 * @param refreshToken     the refresh token, may be null
 * @param expiresAtEpochMs when the access token stops being usable
 */
public record TokenSet(String accessToken, String refreshToken, long expiresAtEpochMs) {

  public TokenSet {
    Objects.requireNonNull(accessToken, "accessToken");
  }

  /**
   * Builds the token set that results from a token endpoint response. When the response
   * carries no refresh token the previous one is retained.
   *
   * @param response             the token response
   * @param previousRefreshToken the refresh token currently held, may be null
   * @param now                  the time the response was received
   * @return the token set
   */
  public static TokenSet from(final TokenResponse response,
                              final String previousRefreshToken,
                              final Instant now) {
    String refresh = response.refreshToken() != null ? response.refreshToken() : previousRefreshToken;
    return new TokenSet(response.accessToken(), refresh, now.toEpochMilli() + response.lifetimeSeconds() * 1000L);
  }

  public boolean isExpired(final Instant now) {
    return now.toEpochMilli() >= expiresAtEpochMs;
  }

  @Override
  public String toString() {
    return "TokenSet[accessToken=***, refreshToken=" + (refreshToken == null ? "null" : "***")
        + ", expiresAtEpochMs=" + expiresAtEpochMs + "]";
  }
}
