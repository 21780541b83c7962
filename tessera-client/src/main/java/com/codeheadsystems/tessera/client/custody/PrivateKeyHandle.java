package com.codeheadsystems.tessera.client.custody;

/**
 * Opaque reference to a private key held by a {@link KeyCustody}. Carries no key bytes,
 * is not serializable, and renders as redacted.
 */
public final class PrivateKeyHandle {

  private final String alias;

  PrivateKeyHandle(final String alias) {
    this.alias = alias;
  }

  String alias() {
    return alias;
  }

  @Override
  public String toString() {
    return "PrivateKeyHandle[redacted]";
  }
}
