package com.example.barbicansecrets.core;

import com.example.barbicansecrets.core.errors.SecretErrorKind;
import com.example.barbicansecrets.core.errors.SecretManagerException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Carries cancellation and an optional deadline through every call made to the key manager.
 *
 * <p>A context is created by the caller and handed unchanged to each remote call. Cancelling it
 * from another thread stops a multi-call operation before its next call.
 *
 * <pre>{@code
 * var ctx = RequestContext.withTimeout(Duration.ofSeconds(30));
 * var ref = secretManager.ensureSecret(ctx, "lb-cert", "text/plain", payload);
 * }</pre>
 */
public final class RequestContext {

  private final Instant deadline;
  private final Clock clock;
  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  private RequestContext(final Instant deadline, final Clock clock) {
    this.deadline = deadline;
    this.clock = clock;
  }

  /**
   * Creates a context with no deadline. Each call returns a fresh, independently cancellable
   * instance.
   *
   * @return new context
   */
  public static RequestContext background() {
    return new RequestContext(null, Clock.systemUTC());
  }

  /**
   * Creates a context that expires after the given duration.
   *
   * @param timeout time allowed from now (must be positive)
   * @return new context
   */
  public static RequestContext withTimeout(final Duration timeout) {
    return withTimeout(timeout, Clock.systemUTC());
  }

  /**
   * Creates a context that expires after the given duration measured on {@code clock}.
   *
   * @param timeout time allowed from now (must be positive)
   * @param clock clock used for deadline checks
   * @return new context
   */
  public static RequestContext withTimeout(final Duration timeout, final Clock clock) {
    if (timeout == null || timeout.isNegative() || timeout.isZero())
      throw new IllegalArgumentException("timeout must be positive");
    return new RequestContext(Instant.now(clock).plus(timeout), clock);
  }

  /** Marks the context cancelled. Idempotent. */
  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  public boolean isExpired() {
    return deadline != null && !Instant.now(clock).isBefore(deadline);
  }

  public Optional<Instant> deadline() {
    return Optional.ofNullable(deadline);
  }

  /**
   * Returns the time left before the deadline, if one is set.
   *
   * @return remaining time, {@link Duration#ZERO} once expired
   */
  public Optional<Duration> remaining() {
    return deadline()
        .map(d -> Duration.between(Instant.now(clock), d))
        .map(left -> left.isNegative() ? Duration.ZERO : left);
  }

  /**
   * Throws when the context is cancelled or past its deadline.
   *
   * @throws SecretManagerException of kind {@link SecretErrorKind#CANCELLED}
   */
  public void throwIfDone() {
    if (isCancelled())
      throw new SecretManagerException(SecretErrorKind.CANCELLED, "request context cancelled");
    if (isExpired())
      throw new SecretManagerException(
          SecretErrorKind.CANCELLED, "request context deadline exceeded at " + deadline);
  }
}
