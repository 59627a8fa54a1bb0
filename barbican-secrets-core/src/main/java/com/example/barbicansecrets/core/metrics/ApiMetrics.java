package com.example.barbicansecrets.core.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import java.util.Objects;

/** Opens {@link MetricContext} scopes against a Micrometer registry. */
public final class ApiMetrics {

  public static final String REQUEST_DURATION = "openstack.api.request.duration";
  public static final String REQUEST_ERRORS = "openstack.api.request.errors";

  public static final String TAG_RESOURCE = "resource";
  public static final String TAG_OPERATION = "operation";
  public static final String TAG_OUTCOME = "outcome";

  private final MeterRegistry registry;

  public ApiMetrics(final MeterRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /**
   * Returns an instance bound to Micrometer's global composite registry. Nothing is exported until
   * the application adds a concrete registry to it.
   *
   * @return metrics bound to {@link Metrics#globalRegistry}
   */
  public static ApiMetrics global() {
    return new ApiMetrics(Metrics.globalRegistry);
  }

  /**
   * Opens a measurement scope. Close it with try-with-resources.
   *
   * @param resource API resource, e.g. {@code secret}
   * @param operation API operation, e.g. {@code list}
   * @return an open scope
   */
  public MetricContext start(final String resource, final String operation) {
    return new MetricContext(registry, resource, operation);
  }
}
