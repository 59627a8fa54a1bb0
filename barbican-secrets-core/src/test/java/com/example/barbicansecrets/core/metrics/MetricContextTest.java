package com.example.barbicansecrets.core.metrics;

import static org.junit.jupiter.api.Assertions.*;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MetricContextTest {

  private SimpleMeterRegistry registry;
  private ApiMetrics metrics;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    metrics = new ApiMetrics(registry);
  }

  private long count(final String outcome) {
    final var timer =
        registry
            .find(ApiMetrics.REQUEST_DURATION)
            .tags(
                ApiMetrics.TAG_RESOURCE, "secret",
                ApiMetrics.TAG_OPERATION, "list",
                ApiMetrics.TAG_OUTCOME, outcome)
            .timer();
    return timer == null ? 0 : timer.count();
  }

  private double errors() {
    final var counter = registry.find(ApiMetrics.REQUEST_ERRORS).counter();
    return counter == null ? 0 : counter.count();
  }

  @Test
  @DisplayName("records success when marked before close")
  void recordsSuccess() {
    try (var mc = metrics.start("secret", "list")) {
      mc.success();
    }

    assertEquals(1, count(MetricContext.OUTCOME_SUCCESS));
    assertEquals(0, count(MetricContext.OUTCOME_FAILURE));
    assertEquals(0.0, errors());
  }

  @Test
  @DisplayName("records failure when an exception leaves the scope")
  void recordsFailureOnException() {
    assertThrows(
        IllegalStateException.class,
        () -> {
          try (var ignored = metrics.start("secret", "list")) {
            throw new IllegalStateException("boom");
          }
        });

    assertEquals(1, count(MetricContext.OUTCOME_FAILURE));
    assertEquals(1.0, errors());
  }

  @Test
  @DisplayName("closing twice records once")
  void closeIsIdempotent() {
    final var mc = metrics.start("secret", "list");
    mc.success();
    mc.close();
    mc.close();

    assertEquals(1, count(MetricContext.OUTCOME_SUCCESS));
  }
}
