package com.codeheadsystems.tessera.client.manager;

import com.codeheadsystems.tessera.client.exceptions.CredentialStoreException;
import com.codeheadsystems.tessera.client.model.ApiResult;
import com.codeheadsystems.tessera.client.model.ApiResult.ValidationError.Kind;
import com.codeheadsystems.tessera.client.model.CallbackOutcome;
import com.codeheadsystems.tessera.client.model.CallbackRoute;
import com.codeheadsystems.tessera.client.model.FlowKind;
import com.codeheadsystems.tessera.client.store.CredentialStore;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes a redirect from the user agent to the flow it completes. The query is classified by
 * the presence of {@code iat}, then {@code code}, then {@code error}, in that order.
 */
@Singleton
public class CallbackRouter {

  private static final Logger log = LoggerFactory.getLogger(CallbackRouter.class);

  private final RegistrationManager registrationManager;
  private final TokenManager tokenManager;
  private final CredentialStore credentialStore;

  @Inject
  public CallbackRouter(final RegistrationManager registrationManager,
                        final TokenManager tokenManager,
                        final CredentialStore credentialStore) {
    log.info("CallbackRouter()");
    this.registrationManager = registrationManager;
    this.tokenManager = tokenManager;
    this.credentialStore = credentialStore;
  }

  /**
   * Classifies a callback URI. Pure: no I/O.
   *
   * @param callback the callback uri
   * @return the route
   */
  public static CallbackRoute parse(final URI callback) {
    Map<String, String> params = queryParameters(callback.getRawQuery());
    if (hasText(params.get("iat"))) {
      return new CallbackRoute.Enrollment(params.get("iat"), params.get("state"));
    }
    if (hasText(params.get("code"))) {
      return new CallbackRoute.Login(params.get("code"), params.get("state"));
    }
    if (hasText(params.get("error"))) {
      return new CallbackRoute.Failure(params.get("error"), params.get("error_description"));
    }
    return new CallbackRoute.Unrecognized();
  }

  /**
   * Completes the flow the callback belongs to.
   *
   * @param callback the callback uri
   * @return what was accomplished
   */
  public CompletableFuture<ApiResult<CallbackOutcome>> handle(final URI callback) {
    CallbackRoute route = parse(callback);
    log.debug("handle(): route={}", route);
    if (route instanceof CallbackRoute.Enrollment enrollment) {
      return registrationManager.completeEnrollment(enrollment.iat(), enrollment.state())
          .thenApply(result -> result.map(clientId -> CallbackOutcome.DEVICE_REGISTERED));
    }
    if (route instanceof CallbackRoute.Login login) {
      return tokenManager.completeLogin(login.code(), login.state())
          .thenApply(result -> result.map(ignored -> CallbackOutcome.LOGGED_IN));
    }
    if (route instanceof CallbackRoute.Failure failure) {
      log.info("handle(): authorization server reported {}", failure.error());
      try {
        credentialStore.clearPending(FlowKind.ENROLLMENT);
        credentialStore.clearPending(FlowKind.LOGIN);
      } catch (CredentialStoreException e) {
        log.error("handle(): unable to clear pending flows", e);
        return CompletableFuture.completedFuture(ApiResult.validationError(Kind.CREDENTIAL_STORE, e.getMessage()));
      }
      String message = hasText(failure.description()) ? failure.description() : failure.error();
      return CompletableFuture.completedFuture(ApiResult.protocolError(message, null));
    }
    return CompletableFuture.completedFuture(
        ApiResult.validationError(Kind.MISSING_PREREQUISITE, "callback carries no iat, code or error"));
  }

  private static Map<String, String> queryParameters(final String rawQuery) {
    Map<String, String> params = new HashMap<>();
    if (rawQuery == null || rawQuery.isEmpty()) {
      return params;
    }
    for (String pair : rawQuery.split("&")) {
      int eq = pair.indexOf('=');
      String name = eq < 0 ? pair : pair.substring(0, eq);
      String value = eq < 0 ? "" : pair.substring(eq + 1);
      try {
        params.putIfAbsent(URLDecoder.decode(name, StandardCharsets.UTF_8),
            URLDecoder.decode(value, StandardCharsets.UTF_8));
      } catch (IllegalArgumentException e) {
        log.debug("queryParameters(): skipping malformed parameter");
      }
    }
    return params;
  }

  private static boolean hasText(final String value) {
    return value != null && !value.isBlank();
  }
}
