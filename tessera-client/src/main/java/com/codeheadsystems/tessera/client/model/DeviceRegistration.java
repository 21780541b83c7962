package com.codeheadsystems.tessera.client.model;

import java.util.Objects;

/**
 * The outcome of a successful dynamic client registration. Persisted as one unit, so a
 * client id without its key id (or the reverse) is never observable.
 *
 * @param serverUrl           normalized base URL of the server the device registered with
 * @param clientId            the issued client id
 * @param keyId               the custody key id, also the JWT {@code kid}
 * @param registeredAtEpochMs registration time
 */
public record DeviceRegistration(String serverUrl, String clientId, String keyId, long registeredAtEpochMs) {

  public DeviceRegistration {
    Objects.requireNonNull(serverUrl, "serverUrl");
    if (clientId == null || clientId.isBlank()) {
      throw new IllegalArgumentException("clientId is required");
    }
    if (keyId == null || keyId.isBlank()) {
      throw new IllegalArgumentException("keyId is required");
    }
  }
}
