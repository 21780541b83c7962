package com.codeheadsystems.tessera.client.manager;

import com.auth0.jwt.JWT;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.codeheadsystems.tessera.client.accessor.OAuthServerAccessor;
import com.codeheadsystems.tessera.client.accessor.ServerUrls;
import com.codeheadsystems.tessera.client.config.DeviceClientConfig;
import com.codeheadsystems.tessera.client.crypto.PkceGenerator;
import com.codeheadsystems.tessera.client.custody.KeyCustody;
import com.codeheadsystems.tessera.client.exceptions.CredentialStoreException;
import com.codeheadsystems.tessera.client.exceptions.KeyCustodyException;
import com.codeheadsystems.tessera.client.model.ApiResult;
import com.codeheadsystems.tessera.client.model.ApiResult.ValidationError.Kind;
import com.codeheadsystems.tessera.client.model.DeviceRegistration;
import com.codeheadsystems.tessera.client.model.FlowKind;
import com.codeheadsystems.tessera.client.model.PendingFlowState;
import com.codeheadsystems.tessera.client.store.CredentialStore;
import com.codeheadsystems.tessera.model.api.SystemInfo;
import com.codeheadsystems.tessera.model.registration.ClientRegistrationRequest;
import com.codeheadsystems.tessera.model.registration.ClientRegistrationResponse;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Device enrollment and dynamic client registration (RFC 7591).
 * <p>
 * Enrollment sends the user agent to the server's enrollment page, which redirects back with
 * a single-use initial access token (IAT). Registration then generates a fresh custody key,
 * registers it inline as a JWKS for {@code private_key_jwt}, and stores the issued client id.
 * Every failure after key generation deletes the new key before the result is returned, so a
 * failed registration leaves no key material behind.
 * <p>
 * Concurrent registrations against the same server share a single attempt.
 */
@Singleton
public class RegistrationManager {

  static final String INVALID_IAT_MESSAGE = "invalid or expired IAT";

  private static final Logger log = LoggerFactory.getLogger(RegistrationManager.class);

  private final DeviceClientConfig config;
  private final KeyCustody keyCustody;
  private final CredentialStore credentialStore;
  private final OAuthServerAccessor accessor;
  private final PkceGenerator pkceGenerator;
  private final Clock clock;
  private final SingleFlight<String, ApiResult<String>> registrations = new SingleFlight<>();

  /**
   * Instantiates a new Registration manager.
   *
   * @param config          the config
   * @param keyCustody      the key custody
   * @param credentialStore the credential store
   * @param accessor        the accessor
   * @param pkceGenerator   the source of state values
   * @param clock           the clock
   */
  @Inject
  public RegistrationManager(final DeviceClientConfig config,
                             final KeyCustody keyCustody,
                             final CredentialStore credentialStore,
                             final OAuthServerAccessor accessor,
                             final PkceGenerator pkceGenerator,
                             final Clock clock) {
    log.info("RegistrationManager()");
    this.config = config;
    this.keyCustody = keyCustody;
    this.credentialStore = credentialStore;
    this.accessor = accessor;
    this.pkceGenerator = pkceGenerator;
    this.clock = clock;
  }

  /**
   * Connectivity probe against the server's system info endpoint.
   *
   * @param serverUrl the server url
   * @return the system info
   */
  public CompletableFuture<ApiResult<SystemInfo>> checkServer(final String serverUrl) {
    log.debug("checkServer(serverUrl={})", serverUrl);
    return accessor.getSystemInfo(serverUrl);
  }

  /**
   * The enrollment page URL. Pure: no I/O, deterministic for the same inputs.
   *
   * @param serverUrl the server url
   * @param state     the CSRF state
   * @return the url
   */
  public String buildEnrollmentUrl(final String serverUrl, final String state) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("deviceVersion", config.deviceVersion());
    params.put("deviceType", config.deviceType());
    params.put("deviceAttestation", config.deviceAttestation());
    params.put("redirectUri", config.redirectUri());
    params.put("state", state);
    return ServerUrls.withQuery(ServerUrls.endpoint(serverUrl, OAuthServerAccessor.ENROLL_DEVICE_PATH), params);
  }

  /**
   * Starts an enrollment: mints a state, records it as the pending enrollment (replacing any
   * earlier one) and returns the URL to open in the user agent.
   *
   * @param serverUrl the server url
   * @return the enrollment url
   */
  public ApiResult<String> startEnrollment(final String serverUrl) {
    log.debug("startEnrollment(serverUrl={})", serverUrl);
    final String normalized;
    try {
      normalized = ServerUrls.normalize(serverUrl);
    } catch (IllegalArgumentException e) {
      return ApiResult.validationError(Kind.INVALID_INPUT, e.getMessage());
    }
    String state = pkceGenerator.newState();
    try {
      credentialStore.savePending(PendingFlowState.enrollment(state, normalized));
    } catch (CredentialStoreException e) {
      log.error("startEnrollment(): unable to store pending enrollment", e);
      return ApiResult.validationError(Kind.CREDENTIAL_STORE, e.getMessage());
    }
    return ApiResult.success(buildEnrollmentUrl(normalized, state));
  }

  /**
   * Handles the enrollment callback. The pending enrollment is consumed; a missing or
   * mismatched state is rejected without registering.
   *
   * @param iat   the initial access token from the callback
   * @param state the state from the callback
   * @return the client id
   */
  public CompletableFuture<ApiResult<String>> completeEnrollment(final String iat, final String state) {
    log.debug("completeEnrollment()");
    return PendingFlows.consume(credentialStore, FlowKind.ENROLLMENT, state)
        .flatMapAsync(pending -> registerDevice(pending.serverUrl(), iat));
  }

  /**
   * Registers this device as an OAuth client.
   * <ol>
   *   <li>validate the IAT's {@code exp} locally, no request is made for a bad IAT</li>
   *   <li>generate a custody key pair</li>
   *   <li>export its public JWKS</li>
   *   <li>compose the {@code private_key_jwt} registration request</li>
   *   <li>POST it with the IAT as bearer token</li>
   *   <li>store the registration as one unit</li>
   *   <li>on any failure after step 2, delete the new key</li>
   * </ol>
   * A successful re-registration replaces the previous registration, deletes its key and
   * clears its tokens.
   *
   * @param serverUrl the server url
   * @param iat       the initial access token
   * @return the issued client id
   */
  public CompletableFuture<ApiResult<String>> registerDevice(final String serverUrl, final String iat) {
    log.debug("registerDevice(serverUrl={})", serverUrl);
    final String normalized;
    try {
      normalized = ServerUrls.normalize(serverUrl);
    } catch (IllegalArgumentException e) {
      return CompletableFuture.completedFuture(ApiResult.validationError(Kind.INVALID_INPUT, e.getMessage()));
    }
    return registrations.run(normalized, () -> register(normalized, iat));
  }

  private CompletableFuture<ApiResult<String>> register(final String serverUrl, final String iat) {
    Instant now = clock.instant();
    if (!isUsable(iat, now)) {
      log.warn("registerDevice(): rejecting invalid or expired IAT");
      return CompletableFuture.completedFuture(ApiResult.validationError(Kind.INVALID_IAT, INVALID_IAT_MESSAGE));
    }

    final String keyId;
    try {
      keyId = keyCustody.generateKeyPair();
    } catch (KeyCustodyException e) {
      log.error("registerDevice(): key generation failed", e);
      return CompletableFuture.completedFuture(ApiResult.validationError(Kind.KEY_STORE, e.getMessage()));
    }

    final ClientRegistrationRequest request;
    try {
      request = ClientRegistrationRequest.forPrivateKeyJwt(config.clientName(), config.redirectUri(),
          config.scope(), config.jwksUri(), keyCustody.exportPublicJwks(keyId));
    } catch (KeyCustodyException e) {
      log.error("registerDevice(): JWKS export failed", e);
      discardKey(keyId);
      return CompletableFuture.completedFuture(ApiResult.validationError(Kind.KEY_STORE, e.getMessage()));
    }

    return accessor.registerClient(serverUrl, iat, request)
        .handle((result, throwable) -> {
          if (throwable != null) {
            discardKey(keyId);
            return ApiResult.<String>transportError(throwable);
          }
          if (!result.isSuccess()) {
            log.info("registerDevice(): registration failed, deleting key {}", keyId);
            discardKey(keyId);
            return result.<String>asFailure();
          }
          return persist(serverUrl, keyId, result.toOptional().orElse(null), now);
        });
  }

  private ApiResult<String> persist(final String serverUrl, final String keyId,
                                    final ClientRegistrationResponse response, final Instant now) {
    if (response == null || response.clientId() == null || response.clientId().isBlank()) {
      discardKey(keyId);
      return ApiResult.protocolError("registration response has no client_id", null);
    }
    final Optional<DeviceRegistration> previous;
    try {
      previous = credentialStore.loadRegistration();
      // the registration is saved last: until then the previous one and its key stay valid
      credentialStore.clearTokens();
      credentialStore.clearPending(FlowKind.LOGIN);
      credentialStore.saveRegistration(new DeviceRegistration(serverUrl, response.clientId(), keyId,
          now.toEpochMilli()));
    } catch (CredentialStoreException e) {
      log.error("registerDevice(): unable to store registration", e);
      discardKey(keyId);
      return ApiResult.validationError(Kind.CREDENTIAL_STORE, e.getMessage());
    }
    previous.map(DeviceRegistration::keyId)
        .filter(previousKeyId -> !previousKeyId.equals(keyId))
        .ifPresent(this::discardKey);
    log.info("registerDevice(): registered clientId={} keyId={}", response.clientId(), keyId);
    return ApiResult.success(response.clientId());
  }

  /**
   * True only when a registration is stored and its key is still in custody.
   *
   * @return true if registered
   */
  public boolean isDeviceRegistered() {
    try {
      return credentialStore.loadRegistration()
          .map(registration -> keyCustody.hasKey(registration.keyId()))
          .orElse(false);
    } catch (CredentialStoreException | KeyCustodyException e) {
      log.warn("isDeviceRegistered(): unable to check registration", e);
      return false;
    }
  }

  public Optional<DeviceRegistration> registration() {
    return credentialStore.loadRegistration();
  }

  /**
   * Deletes the registration's key, then clears the registration, tokens and pending flows.
   * A no-op when nothing is registered.
   *
   * @return done, or a store error
   */
  public ApiResult<Void> resetRegistration() {
    log.debug("resetRegistration()");
    try {
      credentialStore.loadRegistration().ifPresent(registration -> keyCustody.deleteKey(registration.keyId()));
    } catch (KeyCustodyException e) {
      log.error("resetRegistration(): unable to delete key", e);
      return ApiResult.validationError(Kind.KEY_STORE, e.getMessage());
    } catch (CredentialStoreException e) {
      log.error("resetRegistration(): unable to read registration", e);
      return ApiResult.validationError(Kind.CREDENTIAL_STORE, e.getMessage());
    }
    try {
      credentialStore.clearAll();
    } catch (CredentialStoreException e) {
      log.error("resetRegistration(): unable to clear credential store", e);
      return ApiResult.validationError(Kind.CREDENTIAL_STORE, e.getMessage());
    }
    return ApiResult.done();
  }

  private void discardKey(final String keyId) {
    try {
      keyCustody.deleteKey(keyId);
    } catch (KeyCustodyException e) {
      log.error("discardKey(): unable to delete key {}", keyId, e);
    }
  }

  private static boolean isUsable(final String iat, final Instant now) {
    if (iat == null || iat.isBlank()) {
      return false;
    }
    try {
      Instant expiresAt = JWT.decode(iat).getExpiresAtAsInstant();
      return expiresAt != null && expiresAt.isAfter(now);
    } catch (JWTDecodeException e) {
      log.debug("isUsable(): IAT is not a decodable JWT");
      return false;
    }
  }
}
