package com.codeheadsystems.tessera.client.accessor;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Server base URL handling shared by the accessor and the managers.
 */
public final class ServerUrls {

  private ServerUrls() {
  }

  /**
   * Trims the URL and strips trailing slashes, so {@code https://h/} and {@code https://h} name
   * the same server.
   *
   * @param serverUrl the server url
   * @return the normalized base URL
   * @throws IllegalArgumentException if it is not an absolute http(s) URL
   */
  public static String normalize(final String serverUrl) {
    if (serverUrl == null || serverUrl.isBlank()) {
      throw new IllegalArgumentException("server URL is required");
    }
    String trimmed = serverUrl.trim();
    while (trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    try {
      URI uri = new URI(trimmed);
      String scheme = uri.getScheme();
      if (uri.getHost() == null || scheme == null
          || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("not an http(s) URL: " + serverUrl);
      }
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("malformed server URL: " + serverUrl, e);
    }
    return trimmed;
  }

  public static String endpoint(final String serverUrl, final String path) {
    return normalize(serverUrl) + path;
  }

  /**
   * Appends form-encoded query parameters in iteration order.
   *
   * @param url    the url
   * @param params the parameters; null values are skipped
   * @return the url with query
   */
  public static String withQuery(final String url, final Map<String, String> params) {
    return url + "?" + formEncode(params);
  }

  static String formEncode(final Map<String, String> params) {
    return params.entrySet().stream()
        .filter(e -> e.getValue() != null)
        .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
        .collect(Collectors.joining("&"));
  }

  private static String encode(final String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
