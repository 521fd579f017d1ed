/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.spring3;

import java.util.List;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import com.macstab.oss.sessionpool.channel.ProcessSessionChannelFactory;
import com.macstab.oss.sessionpool.channel.SessionChannelFactory;
import com.macstab.oss.sessionpool.ipc.IpcPaths;
import com.macstab.oss.sessionpool.ipc.PoolClient;
import com.macstab.oss.sessionpool.metrics.SessionPoolMetrics;

import lombok.extern.slf4j.Slf4j;

/**
 * Auto-configuration for the shared session pool client.
 *
 * <p>Activated unless {@code session-pool.enabled=false}. Provides:
 *
 * <ul>
 *   <li>{@link ProcessSessionChannelFactory} when no other {@link SessionChannelFactory} exists
 *   <li>{@link PoolClient}, activated on startup unless {@code session-pool.activate-on-startup}
 *       is {@code false}, disposed with the context
 * </ul>
 *
 * <p>Runs after the metrics auto-configuration so a Micrometer {@link SessionPoolMetrics} bean is
 * picked up when {@code session-pool-metrics} is on the classpath.
 *
 * @see SessionPoolProperties
 */
@Slf4j
@AutoConfiguration(
    afterName =
        "com.macstab.oss.sessionpool.metrics.autoconfigure.SessionPoolMetricsAutoConfiguration")
@ConditionalOnProperty(
    prefix = "session-pool",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
@EnableConfigurationProperties(SessionPoolProperties.class)
public class SessionPoolAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(SessionChannelFactory.class)
  public SessionChannelFactory sessionChannelFactory(final SessionPoolProperties properties) {
    final var backend = properties.getBackend();
    return new ProcessSessionChannelFactory(
        backend.getExecutable(), backend.getExtraArguments(), backend.getInputCapacity());
  }

  /**
   * Creates the pool client.
   *
   * <p>Activation is asynchronous: the context does not wait for the pools to warm up, and a
   * failed activation is logged rather than failing startup. Callers see empty results until the
   * client is connected or serving.
   *
   * @param properties session pool properties
   * @param channelFactory backend session factory
   * @param metricsProvider metrics collector (optional)
   * @param listeners role and degradation listeners (optional)
   * @return pool client
   */
  @Bean(destroyMethod = "dispose")
  @ConditionalOnMissingBean(PoolClient.class)
  public PoolClient sessionPoolClient(
      final SessionPoolProperties properties,
      final SessionChannelFactory channelFactory,
      final ObjectProvider<SessionPoolMetrics> metricsProvider,
      final ObjectProvider<SessionPoolListener> listeners) {

    final var paths =
        properties.getStateDirectory() != null
            ? IpcPaths.under(properties.getStateDirectory())
            : IpcPaths.defaults();
    final List<SessionPoolListener> ordered = listeners.orderedStream().toList();

    final var client =
        PoolClient.builder()
            .settings(properties.toSettings())
            .channelFactory(channelFactory)
            .paths(paths)
            .metrics(metricsProvider.getIfAvailable())
            .roleListener(role -> ordered.forEach(listener -> listener.onRoleChange(role)))
            .degradedListener(pool -> ordered.forEach(listener -> listener.onPoolDegraded(pool)))
            .build();

    if (log.isInfoEnabled()) {
      log.info(
          "Session pool client {}: model={}, completion slots={}, state={}",
          client.getClientId(),
          properties.getModel(),
          properties.getCompletionPoolSize(),
          paths.getStateDirectory());
    }

    if (properties.isActivateOnStartup()) {
      client
          .activate()
          .whenComplete(
              (ignored, error) -> {
                if (error != null) {
                  log.error("Session pool client {}: activation failed", client.getClientId(), error);
                } else if (log.isInfoEnabled()) {
                  log.info(
                      "Session pool client {}: active as {}",
                      client.getClientId(),
                      client.getRole().wireName());
                }
              });
    }

    return client;
  }
}
