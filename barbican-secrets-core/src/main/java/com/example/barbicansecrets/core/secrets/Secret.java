package com.example.barbicansecrets.core.secrets;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Secret metadata as returned by the Barbican secrets API.
 *
 * <p>The payload is not part of the listing response and is never held here.
 *
 * @param name secret name; not unique on the service side, may be null
 * @param secretRef URL of the secret; its last path segment is the secret id
 * @param secretType Barbican secret type, e.g. {@code opaque}
 * @param algorithm algorithm recorded at creation, e.g. {@code aes}
 * @param mode cipher mode recorded at creation, e.g. {@code cbc}
 * @param bitLength key bit length recorded at creation
 * @param status lifecycle status, e.g. {@code ACTIVE}
 * @param contentTypes content types by label, e.g. {@code default -> text/plain}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Secret(
    @JsonProperty("name") String name,
    @JsonProperty("secret_ref") String secretRef,
    @JsonProperty("secret_type") String secretType,
    @JsonProperty("algorithm") String algorithm,
    @JsonProperty("mode") String mode,
    @JsonProperty("bit_length") Integer bitLength,
    @JsonProperty("status") String status,
    @JsonProperty("content_types") Map<String, String> contentTypes) {}
