package com.codeheadsystems.tessera.client.exceptions;

/**
 * Raised by key custody when a key cannot be created, found or used.
 */
public class KeyCustodyException extends RuntimeException {
  /**
   * Instantiates a new Key custody exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public KeyCustodyException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
