package com.codeheadsystems.tessera.client.model;

/**
 * What a successfully handled callback accomplished.
 */
public enum CallbackOutcome {
  DEVICE_REGISTERED,
  LOGGED_IN
}
