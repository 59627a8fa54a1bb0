/**
 * Root package for the barbican-secrets library.
 *
 * <p>This package contains a small set of focused classes that look up, create and clean up
 * secrets stored in the OpenStack key manager (Barbican), e.g. TLS certificates referenced by load
 * balancer listeners.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.barbicansecrets.core.RequestContext} – cancellation and deadline carried
 *       through every remote call.
 *   <li>{@link com.example.barbicansecrets.core.secrets.SecretManager} – name lookup, ensure,
 *       create, reference parsing and substring bulk delete.
 *   <li>{@link com.example.barbicansecrets.core.secrets.Secret} – immutable secret metadata.
 *   <li>{@link com.example.barbicansecrets.core.client.KeyManagerClient} – list/create/delete port
 *       to the secrets API.
 *   <li>{@link com.example.barbicansecrets.core.client.BarbicanKeyManagerClient} – Barbican v1 REST
 *       implementation.
 *   <li>{@link com.example.barbicansecrets.core.client.KeyManagerClientProvider} – lazily
 *       configured client (endpoint/token/timeout overrides).
 *   <li>{@link com.example.barbicansecrets.core.errors.SecretErrorKind} – failure classification
 *       matched by callers.
 *   <li>{@link com.example.barbicansecrets.core.metrics.MetricContext} – per-call measurement
 *       scope.
 *   <li>{@link com.example.barbicansecrets.core.reactive.ReactiveSecretManager} – Reactor adapter
 *       with cancellation.
 * </ul>
 */
package com.example.barbicansecrets.core;
