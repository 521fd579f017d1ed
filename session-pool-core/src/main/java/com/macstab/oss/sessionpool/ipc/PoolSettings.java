/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.ipc;

import java.nio.file.Path;
import java.time.Duration;

import com.macstab.oss.sessionpool.pool.CommandPool;
import com.macstab.oss.sessionpool.pool.CompletionPool;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

/**
 * Tuning for the pools and the client/server coordination.
 *
 * <p>All durations must be positive. {@code maxReconnectAttempts} bounds both the connect retries
 * during activation and the takeover attempts after a lost server.
 */
@Value
@With
@Builder(toBuilder = true)
public class PoolSettings {

  public static final PoolSettings DEFAULTS = PoolSettings.builder().build();

  @NonNull @Builder.Default String model = "haiku";

  Path workingDirectory;

  @Builder.Default int completionPoolSize = CompletionPool.DEFAULT_POOL_SIZE;
  @Builder.Default int completionMaxReuses = CompletionPool.DEFAULT_MAX_REUSES;
  @Builder.Default int commandMaxReuses = CommandPool.DEFAULT_MAX_REUSES;

  /** Bound on the connect plus client-hello round trip. */
  @NonNull @Builder.Default Duration connectTimeout = Duration.ofSeconds(2);

  /** Bound on every request sent over the socket. */
  @NonNull @Builder.Default Duration requestTimeout = Duration.ofSeconds(60);

  /** Base delay between reconnect attempts; takeover multiplies it by the attempt number. */
  @NonNull @Builder.Default Duration reconnectDelay = Duration.ofMillis(500);

  @Builder.Default int maxReconnectAttempts = 3;
}
