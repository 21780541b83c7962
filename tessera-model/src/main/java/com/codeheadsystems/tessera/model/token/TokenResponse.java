package com.codeheadsystems.tessera.model.token;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a successful token endpoint response (RFC 6749 §5.1).
 * <p>
 * {@code refresh_token} is optional: on a refresh grant the server may choose not to rotate
 * it, in which case the client keeps the one it already holds. {@code expires_in} is only
 * recommended; when it is absent the lifetime is {@link #DEFAULT_EXPIRES_IN_SECONDS}.
 *
 * @param accessToken  the access token
 * @param tokenType    the token type, normally {@code Bearer}
 * @param expiresIn    lifetime of the access token in seconds, may be null
 * @param refreshToken the refresh token, may be null
 * @param scope        the granted scope, may be null
 * @param idToken      the OpenID Connect id token, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenResponse(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("token_type") String tokenType,
    @JsonProperty("expires_in") Long expiresIn,
    @JsonProperty("refresh_token") String refreshToken,
    @JsonProperty("scope") String scope,
    @JsonProperty("id_token") String idToken) {

  public static final long DEFAULT_EXPIRES_IN_SECONDS = 3600L;

  /**
   * The access token lifetime to apply.
   *
   * @return {@code expires_in}, or the default when the server did not send one
   */
  public long lifetimeSeconds() {
    return expiresIn == null ? DEFAULT_EXPIRES_IN_SECONDS : expiresIn;
  }
}
