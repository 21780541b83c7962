package com.codeheadsystems.tessera.client.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Plaintext layout of {@code credentials.enc}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record StoredCredentials(@JsonProperty("serverUrl") String serverUrl,
                         @JsonProperty("clientId") String clientId,
                         @JsonProperty("keyId") String keyId,
                         @JsonProperty("accessToken") String accessToken,
                         @JsonProperty("refreshToken") String refreshToken,
                         @JsonProperty("tokenExpiresAt") long tokenExpiresAt,
                         @JsonProperty("isRegistered") boolean isRegistered,
                         @JsonProperty("registrationDate") long registrationDate) {

  static final StoredCredentials EMPTY = new StoredCredentials(null, null, null, null, null, 0L, false, 0L);

  StoredCredentials withRegistration(final String serverUrl, final String clientId, final String keyId,
                                     final boolean isRegistered, final long registrationDate) {
    return new StoredCredentials(serverUrl, clientId, keyId, accessToken, refreshToken, tokenExpiresAt,
        isRegistered, registrationDate);
  }

  StoredCredentials withTokens(final String accessToken, final String refreshToken, final long tokenExpiresAt) {
    return new StoredCredentials(serverUrl, clientId, keyId, accessToken, refreshToken, tokenExpiresAt,
        isRegistered, registrationDate);
  }
}
