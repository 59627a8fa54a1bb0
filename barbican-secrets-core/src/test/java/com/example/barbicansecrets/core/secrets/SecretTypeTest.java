package com.example.barbicansecrets.core.secrets;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SecretTypeTest {

  @Test
  @DisplayName("wire values resolve in both directions")
  void wireValues() {
    assertEquals("opaque", SecretType.OPAQUE.wireValue());
    assertEquals(SecretType.CERTIFICATE, SecretType.fromWireValue("certificate"));
    assertThrows(IllegalArgumentException.class, () -> SecretType.fromWireValue("OPAQUE"));
  }

  @Test
  @DisplayName("serializes as the lower-case wire value")
  void serializesAsWireValue() throws Exception {
    assertEquals("\"passphrase\"", new ObjectMapper().writeValueAsString(SecretType.PASSPHRASE));
  }

  @Test
  @DisplayName("secret metadata ignores unknown listing fields")
  void secretIgnoresUnknownFields() throws Exception {
    final var json =
        """
        {
          "name": "lb-cert",
          "secret_ref": "http://host/v1/secrets/abc",
          "secret_type": "opaque",
          "bit_length": 256,
          "creator_id": "ignored",
          "expiration": null
        }
        """;

    final var secret = new ObjectMapper().readValue(json, Secret.class);

    assertEquals("lb-cert", secret.name());
    assertEquals("http://host/v1/secrets/abc", secret.secretRef());
    assertEquals(256, secret.bitLength());
    assertNull(secret.contentTypes());
  }
}
