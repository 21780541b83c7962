package com.codeheadsystems.tessera.model.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The authenticated user as returned by {@code GET /api/me}.
 *
 * @param id          the user id
 * @param username    the username
 * @param displayName the display name, may be null
 * @param email       the email, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserInfo(
    @JsonProperty("id") String id,
    @JsonProperty("username") String username,
    @JsonProperty("displayName") String displayName,
    @JsonProperty("email") String email) {
}
