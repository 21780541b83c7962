package com.codeheadsystems.tessera.client.exceptions;

/**
 * The credential store could not be read, decrypted or written.
 */
public class CredentialStoreException extends RuntimeException {
  /**
   * Instantiates a new Credential store exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public CredentialStoreException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
