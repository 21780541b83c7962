package com.codeheadsystems.tessera.model.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Connectivity probe response from {@code GET /api/system/info}.
 *
 * @param version     the server version
 * @param revision    the server build revision
 * @param contextPath the server's public base URL
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SystemInfo(
    @JsonProperty("version") String version,
    @JsonProperty("revision") String revision,
    @JsonProperty("contextPath") String contextPath) {
}
