/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.metrics.micrometer;

import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

@DisplayName("MetricCache")
class MetricCacheTest {

  private SimpleMeterRegistry registry;
  private MetricCache cache;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    cache = new MetricCache(registry, 3);
  }

  @Test
  @DisplayName("should return the same counter for the same name and tags")
  void sameKey_SameCounter() {
    // Act
    final var first = cache.getOrCreateCounter("c", "d", "a", "1");
    final var second = cache.getOrCreateCounter("c", "d", "a", "1");

    // Assert
    assertThat(second).isSameAs(first);
    assertThat(cache.getCacheSize()).isEqualTo(1);
  }

  @Test
  @DisplayName("should reject odd tag pairs")
  void oddTagPairs_Rejected() {
    assertThatIllegalArgumentException()
        .isThrownBy(() -> cache.getOrCreateCounter("c", "d", "a"))
        .withMessageContaining("even length");
  }

  @Test
  @DisplayName("should keep working through the registry when full")
  void full_FallsBackToRegistry() {
    // Arrange
    cache.getOrCreateCounter("c", "d", "a", "1");
    cache.getOrCreateCounter("c", "d", "a", "2");
    cache.getOrCreateTimer("t", "d", "a", "1");

    // Act
    cache.getOrCreateCounter("c", "d", "a", "3").increment();
    cache.getOrCreateCounter("c", "d", "a", "3").increment();

    // Assert
    assertThat(cache.getCacheSize()).isEqualTo(cache.getMaxCacheSize());
    assertThat(registry.counter("c", "a", "3").count()).isEqualTo(2.0);
  }

  @Test
  @DisplayName("should remove only the gauges of the given instance")
  void removeGaugesForInstance() {
    // Arrange
    cache.getOrCreateGaugeValue("g", "d", "instance.name", "a").set(1);
    cache.getOrCreateGaugeValue("g", "d", "instance.name", "b").set(2);

    // Act
    cache.removeGaugesForInstance("a");

    // Assert
    assertThat(registry.find("g").gauges()).hasSize(1);
    assertThat(registry.get("g").tag("instance.name", "b").gauge().value()).isEqualTo(2.0);
    assertThat(cache.getCacheSize()).isEqualTo(1);
  }

  @Test
  @DisplayName("should create exactly one counter under concurrent access")
  void concurrentAccess_SingleCounter() throws Exception {
    // Arrange
    final var wide = new MetricCache(registry, 100);
    final var start = new CountDownLatch(1);
    final var executor = Executors.newFixedThreadPool(8);
    final List<Future<Counter>> results = new ArrayList<>();

    try {
      for (int i = 0; i < 8; i++) {
        results.add(
            executor.submit(
                () -> {
                  start.await();
                  return wide.getOrCreateCounter("c", "d", "a", "1");
                }));
      }

      // Act
      start.countDown();
      final var first = results.get(0).get(5, TimeUnit.SECONDS);

      // Assert
      for (final var result : results) {
        assertThat(result.get(5, TimeUnit.SECONDS)).isSameAs(first);
      }
      assertThat(wide.getCacheSize()).isEqualTo(1);
    } finally {
      executor.shutdownNow();
    }
  }
}
