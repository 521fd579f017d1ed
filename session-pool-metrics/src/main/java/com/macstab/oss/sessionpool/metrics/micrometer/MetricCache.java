/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.metrics.micrometer;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

/**
 * Thread-safe cache for Micrometer meter instances.
 *
 * <p><strong>Problem:</strong> registry lookup with tag matching costs ~100-200ns per call, and
 * slot events are recorded on the pool event loop.
 *
 * <p><strong>Solution:</strong> {@code Counter}, {@code Timer} and gauge values ({@code
 * AtomicInteger}) are cached by a {@code name:tag=value} key. First access registers the meter,
 * later accesses are a map lookup.
 *
 * <p><strong>Graceful Degradation:</strong> past {@code maxCacheSize} entries meters are resolved
 * through the registry directly (slower but works) and a warning is logged.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
final class MetricCache {

  private final MeterRegistry registry;
  private final int maxCacheSize;

  private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>(64);
  private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>(16);
  private final ConcurrentHashMap<String, AtomicInteger> gaugeValues = new ConcurrentHashMap<>(8);
  private final ConcurrentHashMap<String, Meter.Id> gaugeIds = new ConcurrentHashMap<>(8);
  private final AtomicInteger cacheSize = new AtomicInteger(0);

  /**
   * Creates metric cache.
   *
   * @param registry Micrometer meter registry
   * @param maxCacheSize maximum cached meters
   * @throws NullPointerException if registry is null
   * @throws IllegalArgumentException if maxCacheSize &lt;= 0
   */
  MetricCache(final MeterRegistry registry, final int maxCacheSize) {
    this.registry = Objects.requireNonNull(registry, "MeterRegistry must not be null");

    if (maxCacheSize <= 0) {
      throw new IllegalArgumentException("maxCacheSize must be > 0, got: " + maxCacheSize);
    }

    this.maxCacheSize = maxCacheSize;
  }

  /**
   * Gets or creates counter with tags.
   *
   * @param name metric name
   * @param description metric description
   * @param tagPairs tag key-value pairs [key1, value1, key2, value2, ...]
   * @return counter instance (cached or direct)
   * @throws IllegalArgumentException if tagPairs length is odd
   */
  Counter getOrCreateCounter(
      final String name, final String description, final String... tagPairs) {

    validateTagPairs(tagPairs);

    final var key = buildKey(name, tagPairs);
    final var cached = counters.get(key);

    if (cached != null) {
      return cached;
    }

    if (cacheSize.get() < maxCacheSize) {
      return counters.computeIfAbsent(
          key,
          k -> {
            cacheSize.incrementAndGet();
            return Counter.builder(name).description(description).tags(tagPairs).register(registry);
          });
    }
    log.warn(
        "Metric cache full at {} entries. Direct registry used for counter: {}", maxCacheSize, key);
    return Counter.builder(name).description(description).tags(tagPairs).register(registry);
  }

  /**
   * Gets or creates timer with tags.
   *
   * @param name metric name
   * @param description metric description
   * @param tagPairs tag key-value pairs
   * @return timer instance (cached or direct)
   */
  Timer getOrCreateTimer(final String name, final String description, final String... tagPairs) {

    validateTagPairs(tagPairs);

    final var key = buildKey(name, tagPairs);
    final var cached = timers.get(key);

    if (cached != null) {
      return cached;
    }

    if (cacheSize.get() < maxCacheSize) {
      return timers.computeIfAbsent(
          key,
          k -> {
            cacheSize.incrementAndGet();
            return Timer.builder(name).description(description).tags(tagPairs).register(registry);
          });
    }
    log.warn(
        "Metric cache full at {} entries. Direct registry used for timer: {}", maxCacheSize, key);
    return Timer.builder(name).description(description).tags(tagPairs).register(registry);
  }

  /**
   * Gets or creates gauge value with tags.
   *
   * <p><strong>Memory Management:</strong> gauges hold strong references, call {@link
   * #removeGaugesForInstance(String)} when the owner goes away.
   *
   * @param name metric name
   * @param description metric description
   * @param tagPairs tag key-value pairs
   * @return AtomicInteger holding gauge value
   */
  AtomicInteger getOrCreateGaugeValue(
      final String name, final String description, final String... tagPairs) {

    validateTagPairs(tagPairs);

    final var key = buildKey(name, tagPairs);
    final var cached = gaugeValues.get(key);

    if (cached != null) {
      return cached;
    }

    if (cacheSize.get() < maxCacheSize) {
      return gaugeValues.computeIfAbsent(
          key,
          k -> {
            cacheSize.incrementAndGet();
            final var gaugeValue = new AtomicInteger(0);
            final var gauge =
                Gauge.builder(name, gaugeValue, AtomicInteger::get)
                    .description(description)
                    .tags(tagPairs)
                    .register(registry);
            gaugeIds.put(k, gauge.getId());
            return gaugeValue;
          });
    }
    log.warn(
        "Metric cache full at {} entries. Direct registry used for gauge: {}", maxCacheSize, key);
    final var gaugeValue = new AtomicInteger(0);
    Gauge.builder(name, gaugeValue, AtomicInteger::get)
        .description(description)
        .tags(tagPairs)
        .register(registry);
    return gaugeValue;
  }

  /**
   * Removes every cached gauge tagged with the given instance name from cache and registry.
   *
   * @param instanceName value of the {@code instance.name} tag
   */
  void removeGaugesForInstance(final String instanceName) {
    final var pattern = MetricsConfiguration.TAG_INSTANCE_NAME + "=" + instanceName;

    gaugeValues
        .keySet()
        .removeIf(
            key -> {
              if (!key.contains(pattern)) {
                return false;
              }
              final var id = gaugeIds.remove(key);
              if (id != null) {
                registry.remove(id);
              }
              cacheSize.decrementAndGet();
              log.debug("Removed gauge for instance {}: {}", instanceName, key);
              return true;
            });
  }

  /** Key format: {@code metric.name:tag1=value1:tag2=value2}. */
  private String buildKey(final String name, final String... tagPairs) {
    final int capacity = 32 + (tagPairs.length / 2 * 25);
    final var key = new StringBuilder(capacity);

    key.append(name);

    for (int i = 0; i < tagPairs.length; i += 2) {
      key.append(':').append(tagPairs[i]).append('=').append(tagPairs[i + 1]);
    }

    return key.toString();
  }

  private void validateTagPairs(final String... tagPairs) {
    if (tagPairs.length % 2 != 0) {
      throw new IllegalArgumentException(
          "Tag pairs must have even length (key-value pairs), got: " + tagPairs.length);
    }
  }

  int getCacheSize() {
    return cacheSize.get();
  }

  int getMaxCacheSize() {
    return maxCacheSize;
  }
}
