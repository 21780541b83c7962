package com.codeheadsystems.tessera.client.crypto;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Source of the unguessable values the flows depend on: PKCE verifiers and CSRF state.
 * Tests substitute a seeded {@link SecureRandom}.
 *
 * @param random the random source
 */
public record RandomProvider(SecureRandom random) {

  private static final Base64.Encoder URL_SAFE = Base64.getUrlEncoder().withoutPadding();

  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Fills a new array from the random source.
   *
   * @param count number of bytes
   * @return the bytes
   */
  public byte[] randomBytes(final int count) {
    byte[] bytes = new byte[count];
    random.nextBytes(bytes);
    return bytes;
  }

  /**
   * {@code count} random bytes as unpadded base64url, which is safe in query strings and uses
   * only the PKCE unreserved alphabet.
   *
   * @param count number of random bytes
   * @return the encoded token, {@code ceil(count * 4 / 3)} characters long
   */
  public String urlSafeToken(final int count) {
    return URL_SAFE.encodeToString(randomBytes(count));
  }
}
