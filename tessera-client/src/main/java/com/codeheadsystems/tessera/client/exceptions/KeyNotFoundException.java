package com.codeheadsystems.tessera.client.exceptions;

/**
 * No key exists for the requested key id.
 */
public class KeyNotFoundException extends KeyCustodyException {
  /**
   * Instantiates a new Key not found exception.
   *
   * @param keyId the missing key id
   */
  public KeyNotFoundException(final String keyId) {
    super("No key found for keyId: " + keyId, null);
  }
}
