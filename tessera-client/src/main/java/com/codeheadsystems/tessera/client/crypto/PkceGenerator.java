package com.codeheadsystems.tessera.client.crypto;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Proof Key for Code Exchange (RFC 7636) values and CSRF state.
 * <p>
 * Verifiers are 48 random bytes, base64url-encoded without padding: 64 characters from the
 * unreserved alphabet, inside the 43–128 range of §4.1. Challenges use the S256 method.
 */
@Singleton
public class PkceGenerator {

  public static final String CHALLENGE_METHOD = "S256";

  private static final int VERIFIER_BYTES = 48;
  private static final int STATE_BYTES = 16;
  private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();

  private final RandomProvider randomProvider;

  @Inject
  public PkceGenerator(final RandomProvider randomProvider) {
    this.randomProvider = randomProvider;
  }

  /**
   * A fresh code verifier.
   *
   * @return 64 base64url characters
   */
  public String newCodeVerifier() {
    return randomProvider.urlSafeToken(VERIFIER_BYTES);
  }

  /**
   * The S256 challenge: {@code base64url(SHA-256(ascii(verifier)))} without padding.
   *
   * @param verifier the code verifier
   * @return the code challenge
   */
  public String codeChallenge(final String verifier) {
    if (verifier == null || verifier.isEmpty()) {
      throw new IllegalArgumentException("verifier is required");
    }
    return B64URL.encodeToString(sha256(verifier.getBytes(StandardCharsets.US_ASCII)));
  }

  /**
   * An opaque CSRF token for one flow invocation (128 bits).
   *
   * @return the state
   */
  public String newState() {
    return randomProvider.urlSafeToken(STATE_BYTES);
  }

  private static byte[] sha256(final byte[] data) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(data);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
