/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.metrics.autoconfigure;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Configuration properties for session pool metrics.
 *
 * <p><strong>Configuration Example:</strong>
 *
 * <pre>{@code
 * management:
 *   metrics:
 *     session-pool:
 *       enabled: true
 *       instance-name: editor
 *       max-cache-size: 1000
 * }</pre>
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Data
@ConfigurationProperties(prefix = "management.metrics.session-pool")
public class SessionPoolMetricsProperties {

  /**
   * Enable session pool metrics collection.
   *
   * <p><strong>When disabled:</strong> {@code SessionPoolMetrics.NOOP} is used.
   */
  private boolean enabled = true;

  /**
   * Value of the {@code instance.name} tag. Distinguishes several pool clients sharing one
   * registry.
   */
  private String instanceName = "default";

  /**
   * Maximum cached meter instances.
   *
   * <p>Two pools with a handful of slots, a few reasons and outcomes stay well below 200 entries.
   * When the cache is full meters still work through the registry directly.
   */
  private int maxCacheSize = 1000;
}
