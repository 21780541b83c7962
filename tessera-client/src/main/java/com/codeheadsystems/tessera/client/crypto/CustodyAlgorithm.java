package com.codeheadsystems.tessera.client.crypto;

import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.SignatureGenerationException;
import com.auth0.jwt.exceptions.SignatureVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.tessera.client.custody.KeyCustody;
import com.codeheadsystems.tessera.client.exceptions.KeyCustodyException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.Signature;
import java.util.Base64;

/**
 * RS256 {@link Algorithm} whose private key never leaves the {@link KeyCustody}.
 */
public class CustodyAlgorithm extends Algorithm {

  static final String NAME = "RS256";
  static final String SIGNATURE_ALGORITHM = "SHA256withRSA";

  private static final byte JWT_PART_SEPARATOR = (byte) 46;

  private final KeyCustody custody;
  private final String keyId;

  public CustodyAlgorithm(final KeyCustody custody, final String keyId) {
    super(NAME, SIGNATURE_ALGORITHM);
    this.custody = custody;
    this.keyId = keyId;
  }

  @Override
  public String getSigningKeyId() {
    return keyId;
  }

  @Override
  public void verify(final DecodedJWT jwt) {
    byte[] signingInput = (jwt.getHeader() + "." + jwt.getPayload()).getBytes(StandardCharsets.US_ASCII);
    byte[] signatureBytes = Base64.getUrlDecoder().decode(jwt.getSignature());
    try {
      Signature signature = Signature.getInstance(SIGNATURE_ALGORITHM);
      signature.initVerify(custody.publicKey(keyId));
      signature.update(signingInput);
      if (!signature.verify(signatureBytes)) {
        throw new SignatureVerificationException(this);
      }
    } catch (GeneralSecurityException | KeyCustodyException | IllegalArgumentException e) {
      throw new SignatureVerificationException(this, e);
    }
  }

  @Override
  public byte[] sign(final byte[] headerBytes, final byte[] payloadBytes) {
    byte[] contentBytes = new byte[headerBytes.length + 1 + payloadBytes.length];
    System.arraycopy(headerBytes, 0, contentBytes, 0, headerBytes.length);
    contentBytes[headerBytes.length] = JWT_PART_SEPARATOR;
    System.arraycopy(payloadBytes, 0, contentBytes, headerBytes.length + 1, payloadBytes.length);
    return sign(contentBytes);
  }

  @Override
  public byte[] sign(final byte[] contentBytes) {
    try {
      return custody.sign(keyId, contentBytes);
    } catch (KeyCustodyException e) {
      throw new SignatureGenerationException(this, e);
    }
  }
}
