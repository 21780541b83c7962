package com.codeheadsystems.tessera.model.registration;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import java.util.List;

/**
 * Wire model for the dynamic client registration request (RFC 7591 §2).
 * <p>
 * The device registers itself as a confidential client that authenticates at the token
 * endpoint with {@code private_key_jwt} (RFC 7523). The public half of its signing key is
 * sent inline as a JWKS document; the private half never leaves key custody.
 * <p>
 * Used by: {@code POST /connect/register}, bearer-authenticated with the initial access token.
 *
 * @param clientName                  human-readable name derived from the device identity
 * @param redirectUris                the single redirect URI the device accepts callbacks on
 * @param grantTypes                  always {@code authorization_code} and {@code refresh_token}
 * @param responseTypes               always {@code code}
 * @param tokenEndpointAuthMethod     always {@code private_key_jwt}
 * @param tokenEndpointAuthSigningAlg always {@code RS256}
 * @param scope                       space-delimited scopes requested for the client
 * @param jwksUri                     optional JWKS URI; some servers require the member even
 *                                    when the inline {@code jwks} is authoritative
 * @param jwksJson                    the inline JWKS document, serialized verbatim as JSON
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClientRegistrationRequest(
    @JsonProperty("client_name") String clientName,
    @JsonProperty("redirect_uris") List<String> redirectUris,
    @JsonProperty("grant_types") List<String> grantTypes,
    @JsonProperty("response_types") List<String> responseTypes,
    @JsonProperty("token_endpoint_auth_method") String tokenEndpointAuthMethod,
    @JsonProperty("token_endpoint_auth_signing_alg") String tokenEndpointAuthSigningAlg,
    @JsonProperty("scope") String scope,
    @JsonProperty("jwks_uri") String jwksUri,
    @JsonProperty("jwks") @JsonRawValue String jwksJson) {

  public static final String AUTH_METHOD_PRIVATE_KEY_JWT = "private_key_jwt";
  public static final String SIGNING_ALG_RS256 = "RS256";
  public static final List<String> GRANT_TYPES = List.of("authorization_code", "refresh_token");
  public static final List<String> RESPONSE_TYPES = List.of("code");

  /**
   * Builds a request with every protocol-fixed member set for a {@code private_key_jwt} client.
   *
   * @param clientName  the client name
   * @param redirectUri the redirect uri
   * @param scope       the scope
   * @param jwksUri     the jwks uri, may be null
   * @param jwksJson    the inline JWKS JSON
   * @return the client registration request
   */
  public static ClientRegistrationRequest forPrivateKeyJwt(final String clientName,
                                                           final String redirectUri,
                                                           final String scope,
                                                           final String jwksUri,
                                                           final String jwksJson) {
    return new ClientRegistrationRequest(clientName, List.of(redirectUri), GRANT_TYPES, RESPONSE_TYPES,
        AUTH_METHOD_PRIVATE_KEY_JWT, SIGNING_ALG_RS256, scope, jwksUri, jwksJson);
  }
}
