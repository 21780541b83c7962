package com.codeheadsystems.tessera.client.manager;

import com.codeheadsystems.tessera.client.accessor.OAuthServerAccessor;
import com.codeheadsystems.tessera.client.accessor.ServerUrls;
import com.codeheadsystems.tessera.client.config.DeviceClientConfig;
import com.codeheadsystems.tessera.client.crypto.AssertionSigner;
import com.codeheadsystems.tessera.client.crypto.PkceGenerator;
import com.codeheadsystems.tessera.client.exceptions.CredentialStoreException;
import com.codeheadsystems.tessera.client.exceptions.KeyCustodyException;
import com.codeheadsystems.tessera.client.model.ApiResult;
import com.codeheadsystems.tessera.client.model.ApiResult.ValidationError.Kind;
import com.codeheadsystems.tessera.client.model.DeviceRegistration;
import com.codeheadsystems.tessera.client.model.FlowKind;
import com.codeheadsystems.tessera.client.model.PendingFlowState;
import com.codeheadsystems.tessera.client.model.TokenSet;
import com.codeheadsystems.tessera.client.store.CredentialStore;
import com.codeheadsystems.tessera.model.api.UserInfo;
import com.codeheadsystems.tessera.model.token.TokenResponse;
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
 * Authorization code flow with PKCE (RFC 7636) and {@code private_key_jwt} client
 * authentication (RFC 7523) for a registered device.
 * <p>
 * Every token request carries a freshly signed client assertion. Access tokens are refreshed
 * lazily: only a read that finds the stored token expired triggers a refresh. A refresh the
 * server rejects ends the session (tokens cleared) but keeps the registration; a refresh that
 * fails in transport keeps the tokens so the caller can retry. Concurrent refreshes for the
 * same client share one request, so a rotated refresh token is never presented twice.
 */
@Singleton
public class TokenManager {

  private static final Logger log = LoggerFactory.getLogger(TokenManager.class);

  private final DeviceClientConfig config;
  private final AssertionSigner assertionSigner;
  private final PkceGenerator pkceGenerator;
  private final CredentialStore credentialStore;
  private final OAuthServerAccessor accessor;
  private final Clock clock;
  private final SingleFlight<String, ApiResult<Void>> refreshes = new SingleFlight<>();

  /**
   * Instantiates a new Token manager.
   *
   * @param config          the config
   * @param assertionSigner the assertion signer
   * @param pkceGenerator   the pkce generator
   * @param credentialStore the credential store
   * @param accessor        the accessor
   * @param clock           the clock
   */
  @Inject
  public TokenManager(final DeviceClientConfig config,
                      final AssertionSigner assertionSigner,
                      final PkceGenerator pkceGenerator,
                      final CredentialStore credentialStore,
                      final OAuthServerAccessor accessor,
                      final Clock clock) {
    log.info("TokenManager()");
    this.config = config;
    this.assertionSigner = assertionSigner;
    this.pkceGenerator = pkceGenerator;
    this.credentialStore = credentialStore;
    this.accessor = accessor;
    this.clock = clock;
  }

  // ── Authorization ─────────────────────────────────────────────────────────

  /**
   * The authorization endpoint URL. Pure: no I/O.
   *
   * @param serverUrl     the server url
   * @param clientId      the client id
   * @param state         the CSRF state
   * @param codeChallenge the S256 code challenge
   * @return the url
   */
  public String buildAuthorizationUrl(final String serverUrl, final String clientId,
                                      final String state, final String codeChallenge) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("client_id", clientId);
    params.put("redirect_uri", config.redirectUri());
    params.put("response_type", "code");
    params.put("scope", config.scope());
    params.put("state", state);
    params.put("code_challenge", codeChallenge);
    params.put("code_challenge_method", PkceGenerator.CHALLENGE_METHOD);
    return ServerUrls.withQuery(ServerUrls.endpoint(serverUrl, OAuthServerAccessor.AUTHORIZE_PATH), params);
  }

  /**
   * Starts a login: mints a state and a code verifier, records them as the pending login
   * (replacing any earlier one) and returns the authorization URL.
   *
   * @return the authorization url
   */
  public ApiResult<String> startLogin() {
    log.debug("startLogin()");
    try {
      Optional<DeviceRegistration> registration = credentialStore.loadRegistration();
      if (registration.isEmpty()) {
        return ApiResult.validationError(Kind.MISSING_PREREQUISITE, "device is not registered");
      }
      String state = pkceGenerator.newState();
      String verifier = pkceGenerator.newCodeVerifier();
      credentialStore.savePending(PendingFlowState.login(state, verifier));
      return ApiResult.success(buildAuthorizationUrl(registration.get().serverUrl(),
          registration.get().clientId(), state, pkceGenerator.codeChallenge(verifier)));
    } catch (CredentialStoreException e) {
      log.error("startLogin(): credential store unavailable", e);
      return ApiResult.validationError(Kind.CREDENTIAL_STORE, e.getMessage());
    }
  }

  /**
   * Handles the login callback. The pending login is consumed; a missing or mismatched state
   * is rejected without exchanging the code.
   *
   * @param code  the authorization code
   * @param state the state from the callback
   * @return done, or the failure
   */
  public CompletableFuture<ApiResult<Void>> completeLogin(final String code, final String state) {
    log.debug("completeLogin()");
    return PendingFlows.consume(credentialStore, FlowKind.LOGIN, state)
        .flatMapAsync(pending -> exchangeCodeForToken(code, pending.codeVerifier()));
  }

  // ── Tokens ────────────────────────────────────────────────────────────────

  /**
   * Exchanges an authorization code and replaces the stored tokens wholesale. A response
   * without a refresh token leaves the new session without one.
   *
   * @param code         the authorization code
   * @param codeVerifier the verifier whose challenge was sent at authorization
   * @return done, or the failure
   */
  public CompletableFuture<ApiResult<Void>> exchangeCodeForToken(final String code, final String codeVerifier) {
    log.debug("exchangeCodeForToken()");
    if (code == null || code.isBlank() || codeVerifier == null || codeVerifier.isBlank()) {
      return completed(ApiResult.validationError(Kind.INVALID_INPUT, "code and code verifier are required"));
    }
    ApiResult<DeviceRegistration> registration = requireRegistration();
    if (!registration.isSuccess()) {
      return completed(registration.asFailure());
    }
    DeviceRegistration reg = registration.toOptional().orElseThrow();
    Instant now = clock.instant();
    return signAssertion(reg, now).flatMapAsync(assertion ->
        accessor.exchangeAuthorizationCode(reg.serverUrl(), reg.clientId(), code, codeVerifier, assertion)
            .thenApply(result -> result.flatMap(response -> storeTokens(response, null))));
  }

  /**
   * Refreshes the access token. A response without a refresh token keeps the current one.
   *
   * @return done, or the failure
   */
  public CompletableFuture<ApiResult<Void>> refreshAccessToken() {
    log.debug("refreshAccessToken()");
    ApiResult<DeviceRegistration> registration = requireRegistration();
    if (!registration.isSuccess()) {
      return completed(registration.asFailure());
    }
    DeviceRegistration reg = registration.toOptional().orElseThrow();
    return refreshes.run(reg.clientId(), () -> refresh(reg));
  }

  private CompletableFuture<ApiResult<Void>> refresh(final DeviceRegistration registration) {
    final Optional<TokenSet> current;
    try {
      current = credentialStore.loadTokens();
    } catch (CredentialStoreException e) {
      return completed(ApiResult.validationError(Kind.CREDENTIAL_STORE, e.getMessage()));
    }
    String refreshToken = current.map(TokenSet::refreshToken).orElse(null);
    if (refreshToken == null) {
      return completed(ApiResult.validationError(Kind.MISSING_PREREQUISITE, "no refresh token"));
    }
    return signAssertion(registration, clock.instant()).flatMapAsync(assertion ->
        accessor.refreshToken(registration.serverUrl(), registration.clientId(), refreshToken, assertion)
            .thenApply(result -> {
              if (result instanceof ApiResult.ProtocolError) {
                log.info("refreshAccessToken(): refresh rejected, ending session");
                endSession();
              }
              return result.flatMap(response -> storeTokens(response, refreshToken));
            }));
  }

  /**
   * The current access token, refreshed first if it has expired.
   *
   * @return the access token
   */
  public CompletableFuture<ApiResult<String>> validAccessToken() {
    final Optional<TokenSet> tokens;
    try {
      tokens = credentialStore.loadTokens();
    } catch (CredentialStoreException e) {
      return completed(ApiResult.validationError(Kind.CREDENTIAL_STORE, e.getMessage()));
    }
    if (tokens.isEmpty()) {
      return completed(ApiResult.validationError(Kind.MISSING_PREREQUISITE, "not logged in"));
    }
    if (!tokens.get().isExpired(clock.instant())) {
      return completed(ApiResult.success(tokens.get().accessToken()));
    }
    log.debug("validAccessToken(): access token expired, refreshing");
    return refreshAccessToken().thenApply(result -> result.flatMap(ignored -> credentialStore.loadTokens()
        .map(refreshed -> ApiResult.success(refreshed.accessToken()))
        .orElseGet(() -> ApiResult.validationError(Kind.MISSING_PREREQUISITE, "not logged in"))));
  }

  /**
   * Fetches the current user, refreshing the access token first if it has expired. A failed
   * refresh is returned unchanged.
   *
   * @return the user info
   */
  public CompletableFuture<ApiResult<UserInfo>> getUserInfo() {
    log.debug("getUserInfo()");
    ApiResult<DeviceRegistration> registration = requireRegistration();
    if (!registration.isSuccess()) {
      return completed(registration.asFailure());
    }
    String serverUrl = registration.toOptional().orElseThrow().serverUrl();
    return validAccessToken().thenCompose(token -> token.flatMapAsync(
        accessToken -> accessor.getUserInfo(serverUrl, accessToken)));
  }

  /**
   * Whether an unexpired access token is stored.
   *
   * @return true if logged in
   */
  public boolean isLoggedIn() {
    try {
      return credentialStore.loadTokens().map(tokens -> !tokens.isExpired(clock.instant())).orElse(false);
    } catch (CredentialStoreException e) {
      log.warn("isLoggedIn(): credential store unavailable", e);
      return false;
    }
  }

  public Optional<TokenSet> tokens() {
    return credentialStore.loadTokens();
  }

  /**
   * Clears the tokens and any pending login. The registration is untouched.
   *
   * @return done, or a store error
   */
  public ApiResult<Void> logout() {
    log.debug("logout()");
    try {
      credentialStore.clearTokens();
      credentialStore.clearPending(FlowKind.LOGIN);
      return ApiResult.done();
    } catch (CredentialStoreException e) {
      log.error("logout(): credential store unavailable", e);
      return ApiResult.validationError(Kind.CREDENTIAL_STORE, e.getMessage());
    }
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private ApiResult<DeviceRegistration> requireRegistration() {
    try {
      return credentialStore.loadRegistration()
          .map(ApiResult::success)
          .orElseGet(() -> ApiResult.validationError(Kind.MISSING_PREREQUISITE, "device is not registered"));
    } catch (CredentialStoreException e) {
      log.error("requireRegistration(): credential store unavailable", e);
      return ApiResult.validationError(Kind.CREDENTIAL_STORE, e.getMessage());
    }
  }

  private ApiResult<String> signAssertion(final DeviceRegistration registration, final Instant now) {
    try {
      return ApiResult.success(assertionSigner.buildClientAssertion(registration.clientId(),
          accessor.tokenEndpoint(registration.serverUrl()), registration.keyId(), now, config.assertionTtl()));
    } catch (KeyCustodyException e) {
      log.error("signAssertion(): unable to sign with key {}", registration.keyId(), e);
      return ApiResult.validationError(Kind.KEY_STORE, e.getMessage());
    }
  }

  private ApiResult<Void> storeTokens(final TokenResponse response, final String previousRefreshToken) {
    if (response.accessToken() == null || response.accessToken().isBlank()) {
      return ApiResult.protocolError("token response has no access_token", null);
    }
    try {
      credentialStore.saveTokens(TokenSet.from(response, previousRefreshToken, clock.instant()));
      return ApiResult.done();
    } catch (CredentialStoreException e) {
      log.error("storeTokens(): unable to store tokens", e);
      return ApiResult.validationError(Kind.CREDENTIAL_STORE, e.getMessage());
    }
  }

  private void endSession() {
    try {
      credentialStore.clearTokens();
    } catch (CredentialStoreException e) {
      log.error("endSession(): unable to clear tokens", e);
    }
  }

  private static <T> CompletableFuture<ApiResult<T>> completed(final ApiResult<T> result) {
    return CompletableFuture.completedFuture(result);
  }
}
