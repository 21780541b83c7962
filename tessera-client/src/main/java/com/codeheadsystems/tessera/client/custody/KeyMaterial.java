package com.codeheadsystems.tessera.client.custody;

import java.security.interfaces.RSAPublicKey;

/**
 * A custody key pair as seen from outside the custody.
 *
 * @param keyId            the key id
 * @param publicKey        the public key
 * @param privateKeyHandle opaque handle to the private key
 * @param hardwareBacked   whether the private key lives in hardware
 */
public record KeyMaterial(String keyId, RSAPublicKey publicKey, PrivateKeyHandle privateKeyHandle,
                          boolean hardwareBacked) {
}
