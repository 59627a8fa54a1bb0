package com.example.barbicansecrets.core.reactive;

import com.example.barbicansecrets.core.RequestContext;
import com.example.barbicansecrets.core.secrets.Secret;
import com.example.barbicansecrets.core.secrets.SecretManager;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Reactor adapter over {@link SecretManager}.
 *
 * <p>Each returned {@link Mono} is lazy; on subscription it runs the blocking call on a scheduler
 * suited for blocking work with a fresh {@link RequestContext}. Cancelling the subscription cancels
 * that context, so a batch delete stops before its next remote call.
 *
 * <pre>{@code
 * var reactive = new ReactiveSecretManager(SecretManager.fromEnvironment());
 *
 * reactive.ensureSecret("listener-tls", "text/plain", payload)
 *     .map(SecretManager::parseSecretId)
 *     .subscribe(id -> LOGGER.log(INFO, "Using secret {0}", id));
 * }</pre>
 */
public final class ReactiveSecretManager {

  private final SecretManager delegate;
  private final Scheduler scheduler;
  private final Supplier<RequestContext> contextFactory;

  public ReactiveSecretManager(final SecretManager delegate) {
    this(delegate, Schedulers.boundedElastic(), RequestContext::background);
  }

  /**
   * Creates an adapter whose calls expire after {@code timeout}.
   *
   * @param delegate blocking manager
   * @param timeout deadline applied to every call
   * @return new adapter
   */
  public static ReactiveSecretManager withTimeout(
      final SecretManager delegate, final Duration timeout) {
    return new ReactiveSecretManager(
        delegate, Schedulers.boundedElastic(), () -> RequestContext.withTimeout(timeout));
  }

  ReactiveSecretManager(
      final SecretManager delegate,
      final Scheduler scheduler,
      final Supplier<RequestContext> contextFactory) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.contextFactory = Objects.requireNonNull(contextFactory, "contextFactory");
  }

  /** See {@link SecretManager#ensureSecret(RequestContext, String, String, String)}. */
  public Mono<String> ensureSecret(
      final String name, final String secretType, final String payload) {
    return call(ctx -> delegate.ensureSecret(ctx, name, secretType, payload));
  }

  /** See {@link SecretManager#getSecret(RequestContext, String)}. */
  public Mono<Secret> getSecret(final String name) {
    return call(ctx -> delegate.getSecret(ctx, name));
  }

  /** See {@link SecretManager#createSecret(RequestContext, String, String, String)}. */
  public Mono<String> createSecret(
      final String name, final String secretType, final String payload) {
    return call(ctx -> delegate.createSecret(ctx, name, secretType, payload));
  }

  /**
   * See {@link SecretManager#deleteSecrets(RequestContext, String)}.
   *
   * @param partName substring to look for in secret names
   * @return a Mono emitting the number of secrets deleted
   */
  public Mono<Integer> deleteSecrets(final String partName) {
    return call(ctx -> delegate.deleteSecrets(ctx, partName));
  }

  private <T> Mono<T> call(final Function<RequestContext, T> operation) {
    return Mono.defer(
        () -> {
          final var context = contextFactory.get();
          return Mono.fromCallable(() -> operation.apply(context))
              .subscribeOn(scheduler)
              .doOnCancel(context::cancel);
        });
  }
}
