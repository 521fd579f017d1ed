/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.metrics.micrometer;

import lombok.experimental.UtilityClass;

/**
 * Metric names and tag keys for the Micrometer integration.
 *
 * <p><strong>Naming Convention:</strong> {@code session.pool.*}. Micrometer's {@code
 * PrometheusNamingConvention} turns dots into underscores:
 *
 * <pre>
 * session.pool.slot.acquisitions → session_pool_slot_acquisitions_total
 * session.pool.clients.connected → session_pool_clients_connected
 * </pre>
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@UtilityClass
public class MetricsConfiguration {

  /** Metric name prefix. */
  public static final String PREFIX = "session.pool";

  /**
   * Slot hand-outs.
   *
   * <p><strong>Type:</strong> Counter
   *
   * <p><strong>Tags:</strong> {@code pool.name}, {@code slot.index}, {@code waited}
   *
   * <p><strong>Usage:</strong> a high {@code waited=true} share means the pool is too small for
   * the request rate.
   */
  public static final String SLOT_ACQUISITIONS = PREFIX + ".slot.acquisitions";

  /**
   * Waiters replaced by a newer request.
   *
   * <p><strong>Type:</strong> Counter
   */
  public static final String WAITERS_DISPLACED = PREFIX + ".waiters.displaced";

  /**
   * Request latency from dispatch to delivery.
   *
   * <p><strong>Type:</strong> Timer
   *
   * <p><strong>Tags:</strong> {@code pool.name}, {@code outcome} ({@code delivered} or {@code
   * empty})
   */
  public static final String REQUESTS = PREFIX + ".requests";

  /**
   * Slot recycles.
   *
   * <p><strong>Type:</strong> Counter
   *
   * <p><strong>Tags:</strong> {@code pool.name}, {@code slot.index}, {@code reason}
   */
  public static final String SLOT_RECYCLES = PREFIX + ".slot.recycles";

  /** Slots retired by the rapid-recycle circuit breaker (Counter). */
  public static final String SLOT_RETIREMENTS = PREFIX + ".slot.retirements";

  /** Failed warm-up rounds (Counter). */
  public static final String WARMUP_FAILURES = PREFIX + ".warmup.failures";

  /** Transitions into the degraded state (Counter). */
  public static final String POOL_DEGRADATIONS = PREFIX + ".degradations";

  /**
   * Tokens reported by the backend.
   *
   * <p><strong>Type:</strong> Counter
   *
   * <p><strong>Tags:</strong> {@code pool.name}, {@code direction} ({@code input} or {@code
   * output})
   */
  public static final String TOKENS = PREFIX + ".tokens";

  /** Backend cost in US dollars (Counter, base unit {@code usd}). */
  public static final String COST = PREFIX + ".cost";

  /** Leadership transitions of this process (Counter, tag {@code role}). */
  public static final String ROLE_CHANGES = PREFIX + ".role.changes";

  /** Takeover attempts (Counter, tag {@code outcome}). */
  public static final String TAKEOVERS = PREFIX + ".takeovers";

  /** Clients connected to this process's server (Gauge). */
  public static final String CONNECTED_CLIENTS = PREFIX + ".clients.connected";

  // Tag keys
  public static final String TAG_INSTANCE_NAME = "instance.name";
  public static final String TAG_POOL_NAME = "pool.name";
  public static final String TAG_SLOT_INDEX = "slot.index";
  public static final String TAG_WAITED = "waited";
  public static final String TAG_OUTCOME = "outcome";
  public static final String TAG_REASON = "reason";
  public static final String TAG_DIRECTION = "direction";
  public static final String TAG_ROLE = "role";
}
