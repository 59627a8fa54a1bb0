package com.example.barbicansecrets.core.client;

import com.example.barbicansecrets.core.secrets.SecretType;
import java.util.Optional;

/**
 * Server-side filters for listing secrets. Absent filters are not sent.
 *
 * @param name exact name filter, or null
 * @param secretType secret type filter, or null
 */
public record ListOptions(String name, SecretType secretType) {

  public static ListOptions byName(final String name) {
    return new ListOptions(name, null);
  }

  public static ListOptions bySecretType(final SecretType secretType) {
    return new ListOptions(null, secretType);
  }

  public Optional<String> nameFilter() {
    return Optional.ofNullable(name);
  }

  public Optional<SecretType> secretTypeFilter() {
    return Optional.ofNullable(secretType);
  }
}
