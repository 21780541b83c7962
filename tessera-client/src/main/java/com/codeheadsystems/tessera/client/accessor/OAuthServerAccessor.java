package com.codeheadsystems.tessera.client.accessor;

import com.codeheadsystems.tessera.client.config.DeviceClientConfig;
import com.codeheadsystems.tessera.client.model.ApiResult;
import com.codeheadsystems.tessera.model.api.SystemInfo;
import com.codeheadsystems.tessera.model.api.UserInfo;
import com.codeheadsystems.tessera.model.registration.ClientRegistrationRequest;
import com.codeheadsystems.tessera.model.registration.ClientRegistrationResponse;
import com.codeheadsystems.tessera.model.token.TokenErrorResponse;
import com.codeheadsystems.tessera.model.token.TokenResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the authorization server's device endpoints.
 * <p>
 * Handles request serialization, asynchronous dispatch, status classification and response
 * deserialization. Nothing here throws: any status outside 2xx becomes a
 * {@link ApiResult.ProtocolError} carrying the server's OAuth error description when the body
 * has one, and I/O, timeout or JSON failures become a {@link ApiResult.TransportError}.
 * The server URL passed to each call is the base URL (e.g. {@code https://host/path}); path
 * segments are appended per endpoint.
 */
@Singleton
public class OAuthServerAccessor {

  public static final String SYSTEM_INFO_PATH = "/api/system/info";
  public static final String ENROLL_DEVICE_PATH = "/api/auth/enrollDevice";
  public static final String REGISTER_PATH = "/connect/register";
  public static final String AUTHORIZE_PATH = "/oauth2/authorize";
  public static final String TOKEN_PATH = "/oauth2/token";
  public static final String ME_PATH = "/api/me";
  public static final String CLIENT_ASSERTION_TYPE = "urn:ietf:params:oauth:client-assertion-type:jwt-bearer";

  private static final Logger log = LoggerFactory.getLogger(OAuthServerAccessor.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final DeviceClientConfig config;

  /**
   * Instantiates a new OAuth server accessor.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param config       the device client config
   */
  @Inject
  public OAuthServerAccessor(final HttpClient httpClient,
                             final ObjectMapper objectMapper,
                             final DeviceClientConfig config) {
    log.info("OAuthServerAccessor()");
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.config = config;
  }

  /**
   * The token endpoint URL, which is also the audience of every client assertion.
   *
   * @param serverUrl the server base url
   * @return the token endpoint
   */
  public String tokenEndpoint(final String serverUrl) {
    return ServerUrls.endpoint(serverUrl, TOKEN_PATH);
  }

  // ── Probe ─────────────────────────────────────────────────────────────────

  public CompletableFuture<ApiResult<SystemInfo>> getSystemInfo(final String serverUrl) {
    log.debug("getSystemInfo(serverUrl={})", serverUrl);
    return send(serverUrl, SYSTEM_INFO_PATH, builder -> builder.GET(), SystemInfo.class);
  }

  // ── Registration ─────────────────────────────────────────────────────────

  /**
   * Dynamic client registration, authenticated with the initial access token.
   *
   * @param serverUrl          the server base url
   * @param initialAccessToken the single-use initial access token
   * @param request            the registration request
   * @return the registration response
   */
  public CompletableFuture<ApiResult<ClientRegistrationResponse>> registerClient(
      final String serverUrl,
      final String initialAccessToken,
      final ClientRegistrationRequest request) {
    log.debug("registerClient(serverUrl={}, clientName={})", serverUrl, request.clientName());
    final String body;
    try {
      body = objectMapper.writeValueAsString(request);
    } catch (JsonProcessingException e) {
      return CompletableFuture.completedFuture(ApiResult.transportError(e));
    }
    return send(serverUrl, REGISTER_PATH, builder -> builder
            .header("Authorization", "Bearer " + initialAccessToken)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body)),
        ClientRegistrationResponse.class);
  }

  // ── Tokens ────────────────────────────────────────────────────────────────

  /**
   * Authorization code grant with PKCE, authenticated by a client assertion.
   *
   * @param serverUrl       the server base url
   * @param clientId        the client id
   * @param code            the authorization code
   * @param codeVerifier    the PKCE verifier matching the challenge sent at authorization
   * @param clientAssertion the signed client assertion
   * @return the token response
   */
  public CompletableFuture<ApiResult<TokenResponse>> exchangeAuthorizationCode(final String serverUrl,
                                                                               final String clientId,
                                                                               final String code,
                                                                               final String codeVerifier,
                                                                               final String clientAssertion) {
    log.debug("exchangeAuthorizationCode(serverUrl={}, clientId={})", serverUrl, clientId);
    Map<String, String> form = new LinkedHashMap<>();
    form.put("grant_type", "authorization_code");
    form.put("code", code);
    form.put("redirect_uri", config.redirectUri());
    form.put("client_id", clientId);
    form.put("client_assertion_type", CLIENT_ASSERTION_TYPE);
    form.put("client_assertion", clientAssertion);
    form.put("code_verifier", codeVerifier);
    return postForm(serverUrl, form);
  }

  /**
   * Refresh token grant, authenticated by a client assertion.
   *
   * @param serverUrl       the server base url
   * @param clientId        the client id
   * @param refreshToken    the refresh token
   * @param clientAssertion the signed client assertion
   * @return the token response
   */
  public CompletableFuture<ApiResult<TokenResponse>> refreshToken(final String serverUrl,
                                                                  final String clientId,
                                                                  final String refreshToken,
                                                                  final String clientAssertion) {
    log.debug("refreshToken(serverUrl={}, clientId={})", serverUrl, clientId);
    Map<String, String> form = new LinkedHashMap<>();
    form.put("grant_type", "refresh_token");
    form.put("refresh_token", refreshToken);
    form.put("client_id", clientId);
    form.put("client_assertion_type", CLIENT_ASSERTION_TYPE);
    form.put("client_assertion", clientAssertion);
    return postForm(serverUrl, form);
  }

  // ── Resource ──────────────────────────────────────────────────────────────

  public CompletableFuture<ApiResult<UserInfo>> getUserInfo(final String serverUrl, final String accessToken) {
    log.debug("getUserInfo(serverUrl={})", serverUrl);
    return send(serverUrl, ME_PATH, builder -> builder
        .header("Authorization", "Bearer " + accessToken)
        .GET(), UserInfo.class);
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private CompletableFuture<ApiResult<TokenResponse>> postForm(final String serverUrl,
                                                               final Map<String, String> form) {
    String body = ServerUrls.formEncode(form);
    return send(serverUrl, TOKEN_PATH, builder -> builder
        .header("Content-Type", "application/x-www-form-urlencoded")
        .POST(HttpRequest.BodyPublishers.ofString(body)), TokenResponse.class);
  }

  private <T> CompletableFuture<ApiResult<T>> send(final String serverUrl,
                                                   final String path,
                                                   final RequestCustomizer customizer,
                                                   final Class<T> responseType) {
    final HttpRequest request;
    try {
      HttpRequest.Builder builder = HttpRequest.newBuilder()
          .uri(URI.create(ServerUrls.endpoint(serverUrl, path)))
          .timeout(config.httpTimeout())
          .header("Accept", "application/json");
      request = customizer.customize(builder).build();
    } catch (IllegalArgumentException e) {
      return CompletableFuture.completedFuture(
          ApiResult.validationError(ApiResult.ValidationError.Kind.INVALID_INPUT, e.getMessage()));
    }
    return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
        .handle((response, throwable) -> {
          if (throwable != null) {
            Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                ? throwable.getCause() : throwable;
            log.debug("send(): {} {} failed: {}", request.method(), path, cause.toString());
            return ApiResult.<T>transportError(cause);
          }
          return classify(path, response, responseType);
        });
  }

  private <T> ApiResult<T> classify(final String path, final HttpResponse<String> response,
                                    final Class<T> responseType) {
    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      String message = errorMessage(response.body()).orElse("HTTP " + status);
      log.debug("classify(): {} returned {}", path, status);
      return ApiResult.protocolError(message, status);
    }
    try {
      return ApiResult.success(objectMapper.readValue(response.body(), responseType));
    } catch (IOException | IllegalArgumentException e) {
      return ApiResult.transportError(e);
    }
  }

  private Optional<String> errorMessage(final String body) {
    if (body == null || body.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(objectMapper.readValue(body, TokenErrorResponse.class).describe());
    } catch (IOException e) {
      log.debug("errorMessage(): body is not an OAuth error document");
      return Optional.empty();
    }
  }

  @FunctionalInterface
  private interface RequestCustomizer {
    HttpRequest.Builder customize(HttpRequest.Builder builder);
  }
}
