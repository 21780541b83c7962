package com.codeheadsystems.tessera.client.model;

/**
 * The user-agent driven flows that hold pending state between initiation and callback.
 */
public enum FlowKind {
  ENROLLMENT,
  LOGIN
}
