package com.example.barbicansecrets.core.errors;

/**
 * Classification of failures raised by the secret helpers.
 *
 * <p>Callers match on the kind rather than on exception identity.
 */
public enum SecretErrorKind {
  /** A name lookup returned no secret. */
  NOT_FOUND,
  /** A name lookup returned more than one secret. */
  AMBIGUOUS_RESULT,
  /** A secret reference has no identifier segment. */
  MALFORMED_REFERENCE,
  /** Any other failure reported by the key manager or the transport. */
  REMOTE_SERVICE,
  /** The request context was cancelled or its deadline passed. */
  CANCELLED
}
