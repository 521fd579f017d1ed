/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.metrics.autoconfigure;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import com.macstab.oss.sessionpool.metrics.SessionPoolMetrics;
import com.macstab.oss.sessionpool.metrics.micrometer.MicrometerSessionPoolMetrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Spring Boot auto-configuration for session pool metrics.
 *
 * <p><strong>Activation Conditions:</strong>
 *
 * <ol>
 *   <li>{@code MeterRegistry.class} on classpath (Micrometer present)
 *   <li>{@code MeterRegistry} bean exists (Spring Boot Actuator configured)
 *   <li>{@code management.metrics.session-pool.enabled=true} (default: true)
 * </ol>
 *
 * <p><strong>Bean Created:</strong>
 *
 * <ul>
 *   <li>If conditions met: {@code MicrometerSessionPoolMetrics}
 *   <li>Otherwise: {@link SessionPoolMetrics#NOOP}
 * </ul>
 *
 * <p>The starter injects whichever bean exists into the {@code PoolClient}. Ordered after the
 * actuator's registry configuration so its {@code MeterRegistry} is visible.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
@AutoConfiguration(
    afterName =
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(MeterRegistry.class)
@EnableConfigurationProperties(SessionPoolMetricsProperties.class)
public class SessionPoolMetricsAutoConfiguration {

  /**
   * Creates the Micrometer-based collector.
   *
   * @param registry Micrometer meter registry
   * @param properties metrics configuration properties
   * @return Micrometer metrics collector
   */
  @Bean
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnProperty(
      prefix = "management.metrics.session-pool",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean(SessionPoolMetrics.class)
  public SessionPoolMetrics micrometerSessionPoolMetrics(
      final MeterRegistry registry, final SessionPoolMetricsProperties properties) {

    log.info(
        "Activating session pool metrics (Micrometer) - instance: '{}', maxCacheSize: {}",
        properties.getInstanceName(),
        properties.getMaxCacheSize());

    return new MicrometerSessionPoolMetrics(
        registry, properties.getInstanceName(), properties.getMaxCacheSize());
  }

  /**
   * No-op collector when metrics are disabled or no registry exists.
   *
   * @return {@link SessionPoolMetrics#NOOP}
   */
  @Bean
  @ConditionalOnMissingBean(SessionPoolMetrics.class)
  public SessionPoolMetrics noOpSessionPoolMetrics() {
    log.debug("Session pool metrics disabled - using NOOP singleton");
    return SessionPoolMetrics.NOOP;
  }
}
