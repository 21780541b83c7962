package com.codeheadsystems.tessera.model.token;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned by the authorization server (RFC 6749 §5.2, RFC 7591 §3.2.2), or by the
 * resource API which reports {@code message} and {@code httpStatusCode} instead.
 *
 * @param error            the OAuth error code
 * @param errorDescription the human-readable description
 * @param message          the API error message
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenErrorResponse(
    @JsonProperty("error") String error,
    @JsonProperty("error_description") String errorDescription,
    @JsonProperty("message") String message) {

  /**
   * The most specific text available, or null when the body carried none.
   *
   * @return the description
   */
  public String describe() {
    if (errorDescription != null && !errorDescription.isBlank()) {
      return errorDescription;
    }
    if (message != null && !message.isBlank()) {
      return message;
    }
    return (error == null || error.isBlank()) ? null : error;
  }
}
