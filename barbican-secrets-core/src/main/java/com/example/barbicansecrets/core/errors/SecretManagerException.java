package com.example.barbicansecrets.core.errors;

import java.util.Objects;

/** Unchecked failure carrying a {@link SecretErrorKind}. */
public class SecretManagerException extends RuntimeException {

  private final SecretErrorKind kind;

  public SecretManagerException(final SecretErrorKind kind, final String message) {
    this(kind, message, null);
  }

  public SecretManagerException(
      final SecretErrorKind kind, final String message, final Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Returns the failure classification.
   *
   * @return the kind, never null
   */
  public SecretErrorKind kind() {
    return kind;
  }

  /**
   * Returns true when this failure has the given kind.
   *
   * @param expected kind to compare against
   * @return whether the kinds match
   */
  public boolean is(final SecretErrorKind expected) {
    return kind == expected;
  }
}
