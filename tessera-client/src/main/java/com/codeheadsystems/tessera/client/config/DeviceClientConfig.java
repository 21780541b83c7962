package com.codeheadsystems.tessera.client.config;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.UUID;

/**
 * Client-side configuration for enrollment, registration and login.
 * <p>
 * The redirect URI must be the one the server accepts for this device type: it is sent in the
 * enrollment request, registered as the client's only redirect URI, and repeated in every
 * authorization and token request. The device fields describe this installation to the
 * enrollment endpoint; {@code deviceId} also names the registered client.
 * <p>
 * Use {@link #defaults()} and the {@code with*} methods to override individual values.
 *
 * @param redirectUri       the redirect URI callbacks arrive on
 * @param deviceType        the device type reported at enrollment
 * @param deviceVersion     the device version reported at enrollment
 * @param deviceAttestation the attestation statement reported at enrollment
 * @param deviceId          a stable identifier for this installation
 * @param clientNamePrefix  prefix of the registered client name
 * @param scope             the scope requested at registration and authorization
 * @param assertionTtl      lifetime of each client assertion
 * @param jwksUri           JWKS URI sent at registration; the inline JWKS is authoritative but
 *                          servers expect the member, so the default is a placeholder. Null omits it
 * @param httpTimeout       per-request HTTP timeout
 */
public record DeviceClientConfig(String redirectUri,
                                 String deviceType,
                                 String deviceVersion,
                                 String deviceAttestation,
                                 String deviceId,
                                 String clientNamePrefix,
                                 String scope,
                                 Duration assertionTtl,
                                 String jwksUri,
                                 Duration httpTimeout) {

  public static final String DEFAULT_REDIRECT_URI = "tessera://oauth";
  public static final String DEFAULT_DEVICE_TYPE = "java";
  public static final String DEFAULT_CLIENT_NAME_PREFIX = "Tessera Device";
  public static final String DEFAULT_SCOPE = "openid profile username";
  public static final Duration DEFAULT_ASSERTION_TTL = Duration.ofSeconds(60);
  public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
  public static final String DEFAULT_JWKS_URI = "https://tessera.invalid/jwks.json";

  public DeviceClientConfig {
    requireText(redirectUri, "redirectUri");
    requireText(deviceType, "deviceType");
    requireText(deviceId, "deviceId");
    requireText(scope, "scope");
    Objects.requireNonNull(assertionTtl, "assertionTtl");
    Objects.requireNonNull(httpTimeout, "httpTimeout");
    if (assertionTtl.isNegative() || assertionTtl.isZero()) {
      throw new IllegalArgumentException("assertionTtl must be positive");
    }
  }

  /**
   * Configuration derived from the running JVM.
   *
   * @return the device client config
   */
  public static DeviceClientConfig defaults() {
    String osName = System.getProperty("os.name", "unknown");
    String osVersion = System.getProperty("os.version", "unknown");
    String javaVersion = System.getProperty("java.specification.version", "unknown");
    String seed = System.getProperty("user.name", "") + '@' + osName + '/' + System.getProperty("os.arch", "");
    String deviceId = UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8)).toString();
    return new DeviceClientConfig(DEFAULT_REDIRECT_URI, DEFAULT_DEVICE_TYPE, osName + " " + osVersion,
        "jvm_" + javaVersion, deviceId, DEFAULT_CLIENT_NAME_PREFIX, DEFAULT_SCOPE, DEFAULT_ASSERTION_TTL,
        DEFAULT_JWKS_URI, DEFAULT_HTTP_TIMEOUT);
  }

  public DeviceClientConfig withRedirectUri(final String value) {
    return new DeviceClientConfig(value, deviceType, deviceVersion, deviceAttestation, deviceId,
        clientNamePrefix, scope, assertionTtl, jwksUri, httpTimeout);
  }

  public DeviceClientConfig withDeviceId(final String value) {
    return new DeviceClientConfig(redirectUri, deviceType, deviceVersion, deviceAttestation, value,
        clientNamePrefix, scope, assertionTtl, jwksUri, httpTimeout);
  }

  public DeviceClientConfig withScope(final String value) {
    return new DeviceClientConfig(redirectUri, deviceType, deviceVersion, deviceAttestation, deviceId,
        clientNamePrefix, value, assertionTtl, jwksUri, httpTimeout);
  }

  public DeviceClientConfig withJwksUri(final String value) {
    return new DeviceClientConfig(redirectUri, deviceType, deviceVersion, deviceAttestation, deviceId,
        clientNamePrefix, scope, assertionTtl, value, httpTimeout);
  }

  public DeviceClientConfig withHttpTimeout(final Duration value) {
    return new DeviceClientConfig(redirectUri, deviceType, deviceVersion, deviceAttestation, deviceId,
        clientNamePrefix, scope, assertionTtl, jwksUri, value);
  }

  /**
   * The name the client is registered under.
   *
   * @return the client name
   */
  public String clientName() {
    return (clientNamePrefix == null || clientNamePrefix.isBlank())
        ? deviceId
        : clientNamePrefix + " - " + deviceId;
  }

  private static void requireText(final String value, final String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " is required");
    }
  }
}
