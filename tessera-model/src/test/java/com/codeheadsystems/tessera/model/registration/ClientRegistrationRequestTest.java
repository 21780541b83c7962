package com.codeheadsystems.tessera.model.registration;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class ClientRegistrationRequestTest {

  private static final String JWKS = "{\"keys\":[{\"kty\":\"RSA\",\"kid\":\"k1\",\"n\":\"AQAB\",\"e\":\"AQAB\"}]}";

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void forPrivateKeyJwt_fixesProtocolMembers() {
    ClientRegistrationRequest req = ClientRegistrationRequest.forPrivateKeyJwt(
        "Tessera Device - abc", "tessera://oauth", "openid profile username", null, JWKS);

    assertThat(req.redirectUris()).containsExactly("tessera://oauth");
    assertThat(req.grantTypes()).containsExactly("authorization_code", "refresh_token");
    assertThat(req.responseTypes()).containsExactly("code");
    assertThat(req.tokenEndpointAuthMethod()).isEqualTo("private_key_jwt");
    assertThat(req.tokenEndpointAuthSigningAlg()).isEqualTo("RS256");
  }

  @Test
  void serialize_embedsJwksAsObjectAndUsesSnakeCase() throws Exception {
    ClientRegistrationRequest req = ClientRegistrationRequest.forPrivateKeyJwt(
        "name", "tessera://oauth", "openid", "https://example.org/jwks.json", JWKS);

    JsonNode json = mapper.readTree(mapper.writeValueAsString(req));

    assertThat(json.get("client_name").asText()).isEqualTo("name");
    assertThat(json.get("token_endpoint_auth_method").asText()).isEqualTo("private_key_jwt");
    assertThat(json.get("jwks_uri").asText()).isEqualTo("https://example.org/jwks.json");
    assertThat(json.get("jwks").isObject()).isTrue();
    assertThat(json.get("jwks").get("keys").get(0).get("kid").asText()).isEqualTo("k1");
  }

  @Test
  void serialize_nullJwksUri_isOmitted() throws Exception {
    ClientRegistrationRequest req = ClientRegistrationRequest.forPrivateKeyJwt(
        "name", "tessera://oauth", "openid", null, JWKS);

    JsonNode json = mapper.readTree(mapper.writeValueAsString(req));

    assertThat(json.has("jwks_uri")).isFalse();
  }

  @Test
  void response_ignoresUnknownMembers() throws Exception {
    String body = "{\"client_id\":\"client_abc\",\"client_id_issued_at\":1700000000,"
        + "\"jwks\":{\"keys\":[]},\"registration_access_token\":\"x\"}";

    ClientRegistrationResponse resp = mapper.readValue(body, ClientRegistrationResponse.class);

    assertThat(resp.clientId()).isEqualTo("client_abc");
    assertThat(resp.clientIdIssuedAt()).isEqualTo(1700000000L);
  }
}
