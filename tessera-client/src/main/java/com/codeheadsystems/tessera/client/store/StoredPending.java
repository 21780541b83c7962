package com.codeheadsystems.tessera.client.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Plaintext layout of {@code pending.enc}. Enrollment uses the {@code pending*} fields, login
 * the {@code oauth*} fields.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record StoredPending(@JsonProperty("pendingState") String pendingState,
                     @JsonProperty("pendingServerUrl") String pendingServerUrl,
                     @JsonProperty("oauthState") String oauthState,
                     @JsonProperty("oauthCodeVerifier") String oauthCodeVerifier) {

  static final StoredPending EMPTY = new StoredPending(null, null, null, null);

  StoredPending withEnrollment(final String state, final String serverUrl) {
    return new StoredPending(state, serverUrl, oauthState, oauthCodeVerifier);
  }

  StoredPending withLogin(final String state, final String codeVerifier) {
    return new StoredPending(pendingState, pendingServerUrl, state, codeVerifier);
  }
}
