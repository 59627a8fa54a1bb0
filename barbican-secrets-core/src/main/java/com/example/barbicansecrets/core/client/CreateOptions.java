package com.example.barbicansecrets.core.client;

import com.example.barbicansecrets.core.secrets.SecretType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Attributes of a secret to create, serialized as the Barbican create request body.
 *
 * @param name secret name
 * @param algorithm algorithm metadata
 * @param mode cipher mode metadata
 * @param bitLength bit length metadata
 * @param payloadContentType content type of the payload
 * @param payloadContentEncoding encoding of the payload, e.g. {@code base64}
 * @param payload secret content
 * @param secretType secret classification
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateOptions(
    @JsonProperty("name") String name,
    @JsonProperty("algorithm") String algorithm,
    @JsonProperty("mode") String mode,
    @JsonProperty("bit_length") Integer bitLength,
    @JsonProperty("payload_content_type") String payloadContentType,
    @JsonProperty("payload_content_encoding") String payloadContentEncoding,
    @JsonProperty("payload") String payload,
    @JsonProperty("secret_type") SecretType secretType) {

  /** Omits the payload. */
  @Override
  public String toString() {
    return "CreateOptions[name="
        + name
        + ", algorithm="
        + algorithm
        + ", mode="
        + mode
        + ", bitLength="
        + bitLength
        + ", payloadContentType="
        + payloadContentType
        + ", payloadContentEncoding="
        + payloadContentEncoding
        + ", secretType="
        + secretType
        + "]";
  }
}
