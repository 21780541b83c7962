package com.codeheadsystems.tessera.client.crypto;

import com.auth0.jwt.JWT;
import com.auth0.jwt.exceptions.JWTCreationException;
import com.codeheadsystems.tessera.client.custody.KeyCustody;
import com.codeheadsystems.tessera.client.exceptions.KeyCustodyException;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds RFC 7523 client assertions for {@code private_key_jwt} authentication at the token
 * endpoint. Each assertion is a compact RS256 JWS with {@code iss = sub = clientId},
 * {@code aud = tokenEndpoint}, a unique {@code jti}, and the custody key id as {@code kid}.
 */
@Singleton
public class AssertionSigner {

  public static final Duration DEFAULT_TTL = Duration.ofSeconds(60);

  private static final Logger log = LoggerFactory.getLogger(AssertionSigner.class);

  private final KeyCustody custody;

  @Inject
  public AssertionSigner(final KeyCustody custody) {
    log.info("AssertionSigner()");
    this.custody = custody;
  }

  public String buildClientAssertion(final String clientId, final String tokenEndpointUrl,
                                     final String keyId, final Instant now) {
    return buildClientAssertion(clientId, tokenEndpointUrl, keyId, now, DEFAULT_TTL);
  }

  /**
   * Signs a fresh client assertion.
   *
   * @param clientId         issuer and subject
   * @param tokenEndpointUrl audience
   * @param keyId            custody key to sign with
   * @param now              issued-at
   * @param ttl              lifetime, {@code exp = now + ttl}
   * @return the compact JWS
   * @throws KeyCustodyException if the key is missing or signing fails
   */
  public String buildClientAssertion(final String clientId, final String tokenEndpointUrl,
                                     final String keyId, final Instant now, final Duration ttl) {
    log.debug("buildClientAssertion(clientId={}, keyId={})", clientId, keyId);
    try {
      return JWT.create()
          .withKeyId(keyId)
          .withIssuer(clientId)
          .withSubject(clientId)
          .withAudience(tokenEndpointUrl)
          .withIssuedAt(now)
          .withExpiresAt(now.plus(ttl))
          .withJWTId(UUID.randomUUID().toString())
          .sign(new CustodyAlgorithm(custody, keyId));
    } catch (JWTCreationException e) {
      if (e.getCause() instanceof KeyCustodyException custodyException) {
        throw custodyException;
      }
      throw new KeyCustodyException("Unable to sign client assertion", e);
    }
  }
}
