package com.codeheadsystems.tessera.model.registration;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Wire model for a successful client registration response (RFC 7591 §3.2.1).
 * Only {@code client_id} is required; the rest echoes the registered metadata.
 *
 * @param clientId                the issued client identifier
 * @param clientIdIssuedAt        issue time in epoch seconds, may be null
 * @param clientName              the registered client name
 * @param redirectUris            the registered redirect URIs
 * @param grantTypes              the registered grant types
 * @param responseTypes           the registered response types
 * @param tokenEndpointAuthMethod the registered token endpoint auth method
 * @param scope                   the registered scope
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClientRegistrationResponse(
    @JsonProperty("client_id") String clientId,
    @JsonProperty("client_id_issued_at") Long clientIdIssuedAt,
    @JsonProperty("client_name") String clientName,
    @JsonProperty("redirect_uris") List<String> redirectUris,
    @JsonProperty("grant_types") List<String> grantTypes,
    @JsonProperty("response_types") List<String> responseTypes,
    @JsonProperty("token_endpoint_auth_method") String tokenEndpointAuthMethod,
    @JsonProperty("scope") String scope) {
}
