package com.codeheadsystems.tessera.client.accessor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.tessera.client.config.DeviceClientConfig;
import com.codeheadsystems.tessera.client.model.ApiResult;
import com.codeheadsystems.tessera.model.api.SystemInfo;
import com.codeheadsystems.tessera.model.api.UserInfo;
import com.codeheadsystems.tessera.model.registration.ClientRegistrationRequest;
import com.codeheadsystems.tessera.model.registration.ClientRegistrationResponse;
import com.codeheadsystems.tessera.model.token.TokenResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * The type OAuth server accessor test.
 */
@ExtendWith(MockitoExtension.class)
class OAuthServerAccessorTest {

  private static final String SERVER = "https://auth.example.org/base/";
  private static final DeviceClientConfig CONFIG = DeviceClientConfig.defaults()
      .withRedirectUri("tessera://oauth")
      .withHttpTimeout(Duration.ofSeconds(5));

  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<String> httpResponse;

  private OAuthServerAccessor accessor;

  @BeforeEach
  void setUp() {
    accessor = new OAuthServerAccessor(httpClient, new ObjectMapper(), CONFIG);
  }

  private void respond(final int status, final String body) {
    doReturn(CompletableFuture.completedFuture(httpResponse)).when(httpClient).sendAsync(any(), any());
    when(httpResponse.statusCode()).thenReturn(status);
    when(httpResponse.body()).thenReturn(body);
  }

  @SuppressWarnings("unchecked")
  private HttpRequest sentRequest() {
    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).sendAsync(captor.capture(), any(HttpResponse.BodyHandler.class));
    return captor.getValue();
  }

  // ── Probe ─────────────────────────────────────────────────────────────────

  @Test
  void getSystemInfo_success() {
    respond(200, "{\"version\":\"2.41\",\"revision\":\"abc\",\"contextPath\":\"/base\"}");

    ApiResult<SystemInfo> result = accessor.getSystemInfo(SERVER).join();

    assertThat(result.toOptional()).map(SystemInfo::version).contains("2.41");
    HttpRequest request = sentRequest();
    assertThat(request.uri().toString()).isEqualTo("https://auth.example.org/base/api/system/info");
    assertThat(request.method()).isEqualTo("GET");
    assertThat(request.timeout()).contains(Duration.ofSeconds(5));
  }

  @Test
  void getSystemInfo_malformedUrl_isValidationErrorWithoutRequest() {
    ApiResult<SystemInfo> result = accessor.getSystemInfo("not a url").join();

    assertThat(result).isInstanceOf(ApiResult.ValidationError.class);
    assertThat(((ApiResult.ValidationError<SystemInfo>) result).kind())
        .isEqualTo(ApiResult.ValidationError.Kind.INVALID_INPUT);
    verifyNoInteractions(httpClient);
  }

  // ── Registration ─────────────────────────────────────────────────────────

  @Test
  void registerClient_sendsBearerIatAndJson() {
    respond(201, "{\"client_id\":\"client_abc\",\"client_name\":\"x\",\"unknown\":true}");
    ClientRegistrationRequest request = ClientRegistrationRequest.forPrivateKeyJwt("Tessera Device - d",
        "tessera://oauth", "openid", null, "{\"keys\":[]}");

    ApiResult<ClientRegistrationResponse> result = accessor.registerClient(SERVER, "the-iat", request).join();

    assertThat(result.toOptional()).map(ClientRegistrationResponse::clientId).contains("client_abc");
    HttpRequest sent = sentRequest();
    assertThat(sent.uri().getPath()).isEqualTo("/base/connect/register");
    assertThat(sent.method()).isEqualTo("POST");
    assertThat(sent.headers().firstValue("Authorization")).contains("Bearer the-iat");
    assertThat(sent.headers().firstValue("Content-Type")).contains("application/json");
  }

  @Test
  void registerClient_serverRejects_isProtocolErrorWithDescription() {
    respond(401, "{\"error\":\"invalid_token\",\"error_description\":\"IAT already used\"}");

    ApiResult<ClientRegistrationResponse> result = accessor.registerClient(SERVER, "iat",
        ClientRegistrationRequest.forPrivateKeyJwt("n", "tessera://oauth", "openid", null, "{}")).join();

    assertThat(result).isEqualTo(ApiResult.protocolError("IAT already used", 401));
  }

  // ── Tokens ────────────────────────────────────────────────────────────────

  @Test
  void exchangeAuthorizationCode_postsForm() {
    respond(200, "{\"access_token\":\"T1\",\"token_type\":\"Bearer\",\"expires_in\":3600}");

    ApiResult<TokenResponse> result = accessor.exchangeAuthorizationCode(SERVER, "client_abc", "the-code",
        "the-verifier", "the-assertion").join();

    assertThat(result.toOptional()).map(TokenResponse::accessToken).contains("T1");
    assertThat(result.toOptional()).map(TokenResponse::refreshToken).isEmpty();
    HttpRequest sent = sentRequest();
    assertThat(sent.uri().toString()).isEqualTo("https://auth.example.org/base/oauth2/token");
    assertThat(sent.headers().firstValue("Content-Type")).contains("application/x-www-form-urlencoded");
    assertThat(sent.headers().firstValue("Authorization")).isEmpty();
  }

  @Test
  void refreshToken_badRequestWithoutBody_usesStatus() {
    respond(400, "");

    ApiResult<TokenResponse> result = accessor.refreshToken(SERVER, "client_abc", "R1", "assertion").join();

    assertThat(result).isEqualTo(ApiResult.protocolError("HTTP 400", 400));
  }

  @Test
  void redirectToLoginPage_isProtocolError() {
    respond(302, "<html>login</html>");

    ApiResult<SystemInfo> result = accessor.getSystemInfo(SERVER).join();

    assertThat(result).isEqualTo(ApiResult.protocolError("HTTP 302", 302));
  }

  @Test
  void redirectWithJsonBody_isNotParsedAsSuccess() {
    respond(302, "{}");

    ApiResult<UserInfo> result = accessor.getUserInfo(SERVER, "T1").join();

    assertThat(result).isEqualTo(ApiResult.protocolError("HTTP 302", 302));
  }

  @Test
  void tokenEndpoint_isNormalized() {
    assertThat(accessor.tokenEndpoint(SERVER)).isEqualTo("https://auth.example.org/base/oauth2/token");
  }

  // ── Resource ──────────────────────────────────────────────────────────────

  @Test
  void getUserInfo_sendsBearerAccessToken() {
    respond(200, "{\"id\":\"u1\",\"username\":\"admin\",\"displayName\":\"Admin\"}");

    ApiResult<UserInfo> result = accessor.getUserInfo(SERVER, "T1").join();

    assertThat(result.toOptional()).map(UserInfo::username).contains("admin");
    assertThat(sentRequest().headers().firstValue("Authorization")).contains("Bearer T1");
  }

  // ── Transport failures ────────────────────────────────────────────────────

  @Test
  void connectFailure_isTransportError() {
    ConnectException cause = new ConnectException("refused");
    doReturn(CompletableFuture.failedFuture(cause)).when(httpClient).sendAsync(any(), any());

    ApiResult<SystemInfo> result = accessor.getSystemInfo(SERVER).join();

    assertThat(result).isEqualTo(ApiResult.transportError(cause));
  }

  @Test
  void timeout_isTransportError() {
    doReturn(CompletableFuture.failedFuture(new HttpTimeoutException("slow")))
        .when(httpClient).sendAsync(any(), any());

    ApiResult<UserInfo> result = accessor.getUserInfo(SERVER, "T1").join();

    assertThat(result).isInstanceOf(ApiResult.TransportError.class);
    assertThat(((ApiResult.TransportError<UserInfo>) result).cause()).isInstanceOf(HttpTimeoutException.class);
  }

  @Test
  void unparsableSuccessBody_isTransportError() {
    respond(200, "<html>not json</html>");

    ApiResult<SystemInfo> result = accessor.getSystemInfo(SERVER).join();

    assertThat(result).isInstanceOf(ApiResult.TransportError.class);
  }
}
