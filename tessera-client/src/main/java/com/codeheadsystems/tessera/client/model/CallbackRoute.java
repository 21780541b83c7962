package com.codeheadsystems.tessera.client.model;

/**
 * Classification of a redirect back from the user-agent.
 */
public sealed interface CallbackRoute
    permits CallbackRoute.Enrollment, CallbackRoute.Login, CallbackRoute.Failure, CallbackRoute.Unrecognized {

  /**
   * Enrollment succeeded and delivered an initial access token.
   *
   * @param iat   the initial access token
   * @param state the echoed state
   */
  record Enrollment(String iat, String state) implements CallbackRoute {

    @Override
    public String toString() {
      return "Enrollment[iat=***]";
    }
  }

  /**
   * Login succeeded and delivered an authorization code.
   *
   * @param code  the authorization code
   * @param state the echoed state
   */
  record Login(String code, String state) implements CallbackRoute {

    @Override
    public String toString() {
      return "Login[code=***]";
    }
  }

  /**
   * Either flow failed at the server.
   *
   * @param error       the error code
   * @param description the error description, may be null
   */
  record Failure(String error, String description) implements CallbackRoute {
  }

  /**
   * None of {@code iat}, {@code code} or {@code error} was present.
   */
  record Unrecognized() implements CallbackRoute {
  }
}
