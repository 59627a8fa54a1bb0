package com.example.barbicansecrets.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Measurement scope around a single remote call.
 *
 * <p>The timer starts when the scope is opened and stops when it is closed. A scope closed without
 * {@link #success()} is recorded as a failure, so early returns and exceptions are both counted.
 *
 * <pre>{@code
 * try (var mc = metrics.start("secret", "list")) {
 *   var result = client.list(ctx, options);
 *   mc.success();
 *   return result;
 * }
 * }</pre>
 */
public final class MetricContext implements AutoCloseable {

  static final String OUTCOME_SUCCESS = "success";
  static final String OUTCOME_FAILURE = "failure";

  private final MeterRegistry registry;
  private final String resource;
  private final String operation;
  private final Timer.Sample sample;
  private boolean succeeded;
  private boolean closed;

  MetricContext(final MeterRegistry registry, final String resource, final String operation) {
    this.registry = registry;
    this.resource = resource;
    this.operation = operation;
    this.sample = Timer.start(registry);
  }

  /** Marks the call as successful. */
  public void success() {
    succeeded = true;
  }

  @Override
  public void close() {
    if (closed) return;
    closed = true;

    final var outcome = succeeded ? OUTCOME_SUCCESS : OUTCOME_FAILURE;
    sample.stop(
        Timer.builder(ApiMetrics.REQUEST_DURATION)
            .description("Latency of key manager API requests")
            .tag(ApiMetrics.TAG_RESOURCE, resource)
            .tag(ApiMetrics.TAG_OPERATION, operation)
            .tag(ApiMetrics.TAG_OUTCOME, outcome)
            .register(registry));

    if (!succeeded)
      Counter.builder(ApiMetrics.REQUEST_ERRORS)
          .description("Failed key manager API requests")
          .tag(ApiMetrics.TAG_RESOURCE, resource)
          .tag(ApiMetrics.TAG_OPERATION, operation)
          .register(registry)
          .increment();
  }
}
