/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.metrics.micrometer;

import static com.macstab.oss.sessionpool.metrics.micrometer.MetricsConfiguration.*;

import java.time.Duration;
import java.util.Objects;

import com.macstab.oss.sessionpool.metrics.SessionPoolMetrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Micrometer implementation of {@link SessionPoolMetrics} with dimensional tags.
 *
 * <p><strong>Dimensional Metrics:</strong> every meter carries the {@code instance.name} tag so
 * several pool clients can share one registry. Slot-level meters add {@code pool.name} ({@code
 * completion}, {@code command}).
 *
 * <p><strong>Metrics Published:</strong>
 *
 * <table>
 *   <caption>Metric Summary</caption>
 *   <thead>
 *     <tr><th>Metric</th><th>Type</th><th>Extra tags</th></tr>
 *   </thead>
 *   <tbody>
 *     <tr><td>{@code session.pool.slot.acquisitions}</td><td>Counter</td>
 *         <td>pool.name, slot.index, waited</td></tr>
 *     <tr><td>{@code session.pool.waiters.displaced}</td><td>Counter</td><td>pool.name</td></tr>
 *     <tr><td>{@code session.pool.requests}</td><td>Timer</td><td>pool.name, outcome</td></tr>
 *     <tr><td>{@code session.pool.slot.recycles}</td><td>Counter</td>
 *         <td>pool.name, slot.index, reason</td></tr>
 *     <tr><td>{@code session.pool.slot.retirements}</td><td>Counter</td>
 *         <td>pool.name, slot.index</td></tr>
 *     <tr><td>{@code session.pool.warmup.failures}</td><td>Counter</td><td>pool.name</td></tr>
 *     <tr><td>{@code session.pool.degradations}</td><td>Counter</td><td>pool.name</td></tr>
 *     <tr><td>{@code session.pool.tokens}</td><td>Counter</td><td>pool.name, direction</td></tr>
 *     <tr><td>{@code session.pool.cost}</td><td>Counter</td><td>pool.name</td></tr>
 *     <tr><td>{@code session.pool.role.changes}</td><td>Counter</td><td>role</td></tr>
 *     <tr><td>{@code session.pool.takeovers}</td><td>Counter</td><td>outcome</td></tr>
 *     <tr><td>{@code session.pool.clients.connected}</td><td>Gauge</td><td></td></tr>
 *   </tbody>
 * </table>
 *
 * <p><strong>Memory Management:</strong> the connected-clients gauge holds a strong reference in
 * the registry; {@link #close()} removes it. Spring calls {@code close()} as the inferred destroy
 * method.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class MicrometerSessionPoolMetrics implements SessionPoolMetrics {

  private final MetricCache cache;
  private final String instanceName;

  private volatile boolean closed = false;

  /**
   * Creates Micrometer metrics collector.
   *
   * @param registry Micrometer meter registry
   * @param instanceName value of the {@code instance.name} tag
   * @param maxCacheSize maximum cached meters
   * @throws NullPointerException if registry or instanceName is null
   * @throws IllegalArgumentException if maxCacheSize &lt;= 0
   */
  public MicrometerSessionPoolMetrics(
      final MeterRegistry registry,
      final String instanceName,
      final int maxCacheSize) {

    Objects.requireNonNull(registry, "MeterRegistry must not be null");
    this.instanceName = Objects.requireNonNull(instanceName, "instanceName must not be null");
    this.cache = new MetricCache(registry, maxCacheSize);

    log.debug(
        "Created MicrometerSessionPoolMetrics for instance '{}' (maxCacheSize: {})",
        instanceName,
        maxCacheSize);
  }

  public MicrometerSessionPoolMetrics(
      final MeterRegistry registry, final String instanceName) {
    this(registry, instanceName, 1000);
  }

  @Override
  public void recordSlotAcquired(final String pool, final int slotIndex, final boolean waited) {
    if (closed) {
      return;
    }

    if (slotIndex < 0) {
      log.warn("Invalid slot index: {} (negative), skipping metric", slotIndex);
      return;
    }

    cache
        .getOrCreateCounter(
            SLOT_ACQUISITIONS,
            "Slot hand-outs (waited=true when the caller was parked first)",
            TAG_INSTANCE_NAME,
            instanceName,
            TAG_POOL_NAME,
            pool,
            TAG_SLOT_INDEX,
            String.valueOf(slotIndex),
            TAG_WAITED,
            String.valueOf(waited))
        .increment();
  }

  @Override
  public void recordWaiterDisplaced(final String pool) {
    if (closed) {
      return;
    }

    cache
        .getOrCreateCounter(
            WAITERS_DISPLACED,
            "Waiting requests replaced by a newer one",
            TAG_INSTANCE_NAME,
            instanceName,
            TAG_POOL_NAME,
            pool)
        .increment();
  }

  @Override
  public void recordRequest(final String pool, final Duration latency, final boolean delivered) {
    if (closed || latency == null) {
      return;
    }

    cache
        .getOrCreateTimer(
            REQUESTS,
            "Request latency from dispatch to delivery",
            TAG_INSTANCE_NAME,
            instanceName,
            TAG_POOL_NAME,
            pool,
            TAG_OUTCOME,
            delivered ? "delivered" : "empty")
        .record(latency);
  }

  @Override
  public void recordSlotRecycled(final String pool, final int slotIndex, final String reason) {
    if (closed) {
      return;
    }

    cache
        .getOrCreateCounter(
            SLOT_RECYCLES,
            "Slot recycles by reason",
            TAG_INSTANCE_NAME,
            instanceName,
            TAG_POOL_NAME,
            pool,
            TAG_SLOT_INDEX,
            String.valueOf(slotIndex),
            TAG_REASON,
            reason)
        .increment();
  }

  @Override
  public void recordSlotRetired(final String pool, final int slotIndex) {
    if (closed) {
      return;
    }

    cache
        .getOrCreateCounter(
            SLOT_RETIREMENTS,
            "Slots retired after rapid recycling",
            TAG_INSTANCE_NAME,
            instanceName,
            TAG_POOL_NAME,
            pool,
            TAG_SLOT_INDEX,
            String.valueOf(slotIndex))
        .increment();

    log.debug("Slot {} of pool '{}' retired (instance '{}')", slotIndex, pool, instanceName);
  }

  @Override
  public void recordWarmupFailure(final String pool) {
    if (closed) {
      return;
    }

    cache
        .getOrCreateCounter(
            WARMUP_FAILURES,
            "Failed warm-up rounds",
            TAG_INSTANCE_NAME,
            instanceName,
            TAG_POOL_NAME,
            pool)
        .increment();
  }

  @Override
  public void recordPoolDegraded(final String pool) {
    if (closed) {
      return;
    }

    cache
        .getOrCreateCounter(
            POOL_DEGRADATIONS,
            "Transitions into the degraded state",
            TAG_INSTANCE_NAME,
            instanceName,
            TAG_POOL_NAME,
            pool)
        .increment();
  }

  @Override
  public void recordUsage(
      final String pool, final long inputTokens, final long outputTokens, final double costUsd) {
    if (closed) {
      return;
    }

    if (inputTokens > 0) {
      tokens(pool, "input").increment(inputTokens);
    }
    if (outputTokens > 0) {
      tokens(pool, "output").increment(outputTokens);
    }
    if (costUsd > 0) {
      cache
          .getOrCreateCounter(
              COST,
              "Backend cost in US dollars",
              TAG_INSTANCE_NAME,
              instanceName,
              TAG_POOL_NAME,
              pool)
          .increment(costUsd);
    }
  }

  private Counter tokens(final String pool, final String direction) {
    return cache.getOrCreateCounter(
        TOKENS,
        "Tokens reported by the backend",
        TAG_INSTANCE_NAME,
        instanceName,
        TAG_POOL_NAME,
        pool,
        TAG_DIRECTION,
        direction);
  }

  @Override
  public void recordRoleChange(final String role) {
    if (closed) {
      return;
    }

    cache
        .getOrCreateCounter(
            ROLE_CHANGES,
            "Leadership transitions of this process",
            TAG_INSTANCE_NAME,
            instanceName,
            TAG_ROLE,
            role)
        .increment();
  }

  @Override
  public void recordTakeover(final String outcome) {
    if (closed) {
      return;
    }

    cache
        .getOrCreateCounter(
            TAKEOVERS,
            "Takeover attempts after the server connection dropped",
            TAG_INSTANCE_NAME,
            instanceName,
            TAG_OUTCOME,
            outcome)
        .increment();
  }

  @Override
  public void setConnectedClients(final int count) {
    if (closed) {
      return;
    }

    cache
        .getOrCreateGaugeValue(
            CONNECTED_CLIENTS,
            "Clients connected to this process's server",
            TAG_INSTANCE_NAME,
            instanceName)
        .set(Math.max(0, count));
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;

    try {
      cache.removeGaugesForInstance(instanceName);
      log.info("Closed MicrometerSessionPoolMetrics for instance '{}'", instanceName);
    } catch (final RuntimeException e) {
      // Runs during context shutdown, must not throw
      log.error("Error during metrics cleanup for instance '{}'", instanceName, e);
    }
  }

  String getInstanceName() {
    return instanceName;
  }

  int getCacheSize() {
    return cache.getCacheSize();
  }
}
