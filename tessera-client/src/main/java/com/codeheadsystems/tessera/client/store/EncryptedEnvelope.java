package com.codeheadsystems.tessera.client.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * On-disk wrapper around an AES-GCM ciphertext. Byte fields are standard base64.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record EncryptedEnvelope(@JsonProperty("version") int version,
                         @JsonProperty("salt") String salt,
                         @JsonProperty("nonce") String nonce,
                         @JsonProperty("iterations") int iterations,
                         @JsonProperty("ciphertext") String ciphertext) {
}
