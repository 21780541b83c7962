package com.codeheadsystems.tessera.client.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Objects;

/**
 * State held for one in-flight enrollment or login between sending the user-agent away and
 * receiving its callback. Consumed exactly once.
 *
 * @param kind         the flow kind
 * @param state        the CSRF nonce sent with the request
 * @param codeVerifier the PKCE verifier, login only
 * @param serverUrl    the server being enrolled with, enrollment only
 */
public record PendingFlowState(FlowKind kind, String state, String codeVerifier, String serverUrl) {

  public PendingFlowState {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(state, "state");
  }

  public static PendingFlowState enrollment(final String state, final String serverUrl) {
    return new PendingFlowState(FlowKind.ENROLLMENT, state, null, serverUrl);
  }

  public static PendingFlowState login(final String state, final String codeVerifier) {
    return new PendingFlowState(FlowKind.LOGIN, state, codeVerifier, null);
  }

  /**
   * Constant-time comparison against the state echoed by a callback.
   *
   * @param presented the callback's state, may be null
   * @return true if identical
   */
  public boolean matches(final String presented) {
    if (presented == null) {
      return false;
    }
    return MessageDigest.isEqual(state.getBytes(StandardCharsets.UTF_8),
        presented.getBytes(StandardCharsets.UTF_8));
  }

  @Override
  public String toString() {
    return "PendingFlowState[kind=" + kind + ", serverUrl=" + serverUrl + "]";
  }
}
