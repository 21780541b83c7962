package com.codeheadsystems.tessera.client.exceptions;

/**
 * The secure store could not generate or store a new key pair.
 */
public class KeyGenerationException extends KeyCustodyException {
  /**
   * Instantiates a new Key generation exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public KeyGenerationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
