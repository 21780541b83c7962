package com.codeheadsystems.tessera.client.custody;

import com.codeheadsystems.tessera.client.exceptions.KeyCustodyException;
import com.codeheadsystems.tessera.client.exceptions.KeyGenerationException;
import com.codeheadsystems.tessera.client.exceptions.KeyNotFoundException;
import java.security.interfaces.RSAPublicKey;

/**
 * Secure custody of the device's signing keys.
 * <p>
 * Keys are addressed only by their key id. Private key material is used in place through
 * {@link #sign(String, byte[])} and is never returned to callers. Implementations must be
 * thread-safe.
 */
public interface KeyCustody {

  /**
   * Creates an RSA-2048 sign/verify key pair inside the custody.
   *
   * @return a fresh random key id, used as the JWT {@code kid}
   * @throws KeyGenerationException if the secure store is unavailable
   */
  String generateKeyPair();

  /**
   * Whether a key pair exists for the key id.
   *
   * @param keyId the key id
   * @return true if present
   */
  boolean hasKey(String keyId);

  /**
   * Deletes the key pair. A no-op when it does not exist.
   *
   * @param keyId the key id
   */
  void deleteKey(String keyId);

  /**
   * Deletes every key pair this custody manages.
   */
  void deleteAllManagedKeys();

  /**
   * The public half of a key pair.
   *
   * @param keyId the key id
   * @return the public key
   * @throws KeyNotFoundException if absent
   */
  RSAPublicKey publicKey(String keyId);

  /**
   * Describes a key pair without exposing the private key.
   *
   * @param keyId the key id
   * @return the key material
   * @throws KeyNotFoundException if absent
   */
  KeyMaterial keyMaterial(String keyId);

  /**
   * A single-entry JWKS document holding only the public key, tagged with {@code kid = keyId}.
   *
   * @param keyId the key id
   * @return the JWKS JSON
   * @throws KeyNotFoundException if absent
   */
  String exportPublicJwks(String keyId);

  /**
   * Signs with RS256 (RSASSA-PKCS1-v1_5 over SHA-256).
   *
   * @param keyId        the key id
   * @param signingInput the bytes to sign
   * @return the signature
   * @throws KeyNotFoundException if absent
   * @throws KeyCustodyException  if signing fails
   */
  byte[] sign(String keyId, byte[] signingInput);
}
