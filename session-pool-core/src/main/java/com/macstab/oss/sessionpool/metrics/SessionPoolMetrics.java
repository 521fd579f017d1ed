/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.metrics;

import java.time.Duration;

/**
 * Framework-agnostic metrics interface for session pools.
 *
 * <p><strong>Design Pattern:</strong> Interface with default no-op methods. Implementations
 * override only the methods they need; the pool engine calls every method unconditionally (no null
 * checks).
 *
 * <p><strong>Implementations:</strong>
 *
 * <ul>
 *   <li>{@link #NOOP} - Zero-overhead singleton (uses default methods)
 *   <li>{@code MicrometerSessionPoolMetrics} - Micrometer integration (Spring Boot Actuator)
 * </ul>
 *
 * <p><strong>Threading:</strong> Slot events are recorded from the owning pool's event loop; client
 * and server events from socket threads. Implementations MUST be thread-safe.
 *
 * <p><strong>Tags:</strong> Every slot-level method takes the pool label ({@code "completion"},
 * {@code "command"}) so one registry can serve both pools of a process.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
public interface SessionPoolMetrics extends AutoCloseable {

  /** No-op singleton instance (uses default methods). */
  SessionPoolMetrics NOOP = new SessionPoolMetrics() {};

  /**
   * Records a slot hand-out.
   *
   * <p><strong>Metric Type:</strong> Counter, tagged {@code pool}, {@code slot}, {@code waited}.
   *
   * @param pool pool label
   * @param slotIndex slot index (0-based)
   * @param waited {@code true} when the caller was parked as the pending waiter first
   */
  default void recordSlotAcquired(String pool, int slotIndex, boolean waited) {
    // No-op by default
  }

  /**
   * Records a waiter displaced by a newer request (latest-wins).
   *
   * @param pool pool label
   */
  default void recordWaiterDisplaced(String pool) {
    // No-op by default
  }

  /**
   * Records a completed request with its wall-clock latency.
   *
   * @param pool pool label
   * @param latency time between dispatch and delivery
   * @param delivered {@code false} when the caller received an empty result
   */
  default void recordRequest(String pool, Duration latency, boolean delivered) {
    // No-op by default
  }

  /**
   * Records a slot recycle.
   *
   * @param pool pool label
   * @param slotIndex slot index (0-based)
   * @param reason {@code reuse-limit}, {@code stream-failure}, {@code timeout} or {@code
   *     dispatch-failure}
   */
  default void recordSlotRecycled(String pool, int slotIndex, String reason) {
    // No-op by default
  }

  /**
   * Records a slot retired by the rapid-recycle circuit breaker.
   *
   * @param pool pool label
   * @param slotIndex slot index (0-based)
   */
  default void recordSlotRetired(String pool, int slotIndex) {
    // No-op by default
  }

  /**
   * Records a failed warm-up round (one per round, not per slot).
   *
   * @param pool pool label
   */
  default void recordWarmupFailure(String pool) {
    // No-op by default
  }

  /**
   * Records the pool entering the degraded (permanently unavailable) state.
   *
   * @param pool pool label
   */
  default void recordPoolDegraded(String pool) {
    // No-op by default
  }

  /**
   * Records token usage and cost reported by the backend.
   *
   * @param pool pool label
   * @param inputTokens input tokens (cache reads excluded)
   * @param outputTokens output tokens
   * @param costUsd cost in US dollars
   */
  default void recordUsage(String pool, long inputTokens, long outputTokens, double costUsd) {
    // No-op by default
  }

  /**
   * Records a leadership transition of this process.
   *
   * @param role new role ({@code server} or {@code client})
   */
  default void recordRoleChange(String role) {
    // No-op by default
  }

  /**
   * Records a takeover attempt after the leader connection dropped.
   *
   * @param outcome {@code reconnected}, {@code promoted} or {@code failed}
   */
  default void recordTakeover(String outcome) {
    // No-op by default
  }

  /**
   * Sets the number of clients currently connected to this process's server.
   *
   * @param count connected clients
   */
  default void setConnectedClients(int count) {
    // No-op by default
  }

  /**
   * Releases metric resources. Called by whoever created the instance, e.g. on context shutdown.
   *
   * <p>Overrides {@link AutoCloseable#close()} without a checked exception.
   */
  @Override
  default void close() {
    // No-op by default
  }
}
