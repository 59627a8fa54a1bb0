package com.example.barbicansecrets.core.secrets;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/** Barbican secret classifications. */
public enum SecretType {
  SYMMETRIC("symmetric"),
  PUBLIC("public"),
  PRIVATE("private"),
  PASSPHRASE("passphrase"),
  CERTIFICATE("certificate"),
  OPAQUE("opaque");

  private final String wireValue;

  SecretType(final String wireValue) {
    this.wireValue = wireValue;
  }

  /**
   * Returns the value used by the Barbican API.
   *
   * @return lower-case wire value
   */
  @JsonValue
  public String wireValue() {
    return wireValue;
  }

  /**
   * Resolves a wire value.
   *
   * @param value value as sent by the service
   * @return the matching type
   * @throws IllegalArgumentException for unknown values
   */
  public static SecretType fromWireValue(final String value) {
    return Arrays.stream(values())
        .filter(type -> type.wireValue.equals(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown secret type: " + value));
  }
}
