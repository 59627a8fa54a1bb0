package com.example.barbicansecrets.core.errors;

/**
 * Failure reported by the key manager service, or by the transport used to reach it.
 *
 * <p>Always of kind {@link SecretErrorKind#REMOTE_SERVICE}. The HTTP status is kept so callers can
 * tell an absent resource (404) apart from other failures; transport failures carry status 0.
 */
public class KeyManagerException extends SecretManagerException {

  private static final int NOT_FOUND = 404;

  private final int statusCode;

  public KeyManagerException(final int statusCode, final String message) {
    this(statusCode, message, null);
  }

  public KeyManagerException(final int statusCode, final String message, final Throwable cause) {
    super(SecretErrorKind.REMOTE_SERVICE, message, cause);
    this.statusCode = statusCode;
  }

  /**
   * Returns the HTTP status returned by the service.
   *
   * @return status code, or 0 when no response was received
   */
  public int statusCode() {
    return statusCode;
  }

  /**
   * Returns true when the service reported that the resource does not exist.
   *
   * @return whether the status is 404
   */
  public boolean isNotFound() {
    return statusCode == NOT_FOUND;
  }
}
