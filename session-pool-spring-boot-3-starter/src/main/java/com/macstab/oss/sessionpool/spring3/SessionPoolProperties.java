/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.spring3;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.macstab.oss.sessionpool.channel.ProcessSessionChannelFactory;
import com.macstab.oss.sessionpool.ipc.PoolSettings;
import com.macstab.oss.sessionpool.pool.CommandPool;
import com.macstab.oss.sessionpool.pool.CompletionPool;

import lombok.Data;

/**
 * Session pool configuration properties.
 *
 * <pre>{@code
 * session-pool:
 *   model: haiku
 *   completion-pool-size: 2     # 1-8, clamped
 *   state-directory: /tmp/sp    # default ~/.session-pool
 *   request-timeout: 60s
 *   backend:
 *     executable: claude
 *     extra-arguments: [--tools, ""]
 * }</pre>
 *
 * <p>Every process of one user that should share a pool must point at the same {@code
 * state-directory}.
 */
@Data
@ConfigurationProperties(prefix = "session-pool")
public class SessionPoolProperties {

  public static final int MIN_COMPLETION_POOL_SIZE = 1;
  public static final int MAX_COMPLETION_POOL_SIZE = 8;

  /** Creates the {@code PoolClient} bean. */
  private boolean enabled = true;

  /** Joins the group (connect or become server) when the context starts. */
  private boolean activateOnStartup = true;

  /** Directory holding the socket and the lockfile. {@code null} means {@code ~/.session-pool}. */
  private Path stateDirectory;

  /** Backend model for both pools. */
  private String model = "haiku";

  /** Working directory of spawned backend sessions. */
  private Path workingDirectory;

  /**
   * Number of completion slots.
   *
   * <p>Valid range: 1-8. Values outside this range are clamped.
   */
  private int completionPoolSize = CompletionPool.DEFAULT_POOL_SIZE;

  /** Requests a completion session serves before it is recycled. */
  private int completionMaxReuses = CompletionPool.DEFAULT_MAX_REUSES;

  /** Prompts a command session serves before it is recycled. */
  private int commandMaxReuses = CommandPool.DEFAULT_MAX_REUSES;

  private Duration connectTimeout = Duration.ofSeconds(2);

  private Duration requestTimeout = Duration.ofSeconds(60);

  /** Base delay between reconnect attempts; takeover multiplies it by the attempt number. */
  private Duration reconnectDelay = Duration.ofMillis(500);

  private int maxReconnectAttempts = 3;

  private Backend backend = new Backend();

  public void setCompletionPoolSize(final int completionPoolSize) {
    this.completionPoolSize =
        Math.max(MIN_COMPLETION_POOL_SIZE, Math.min(completionPoolSize, MAX_COMPLETION_POOL_SIZE));
  }

  /** Maps the bound properties onto core settings. */
  public PoolSettings toSettings() {
    return PoolSettings.builder()
        .model(model)
        .workingDirectory(workingDirectory)
        .completionPoolSize(completionPoolSize)
        .completionMaxReuses(completionMaxReuses)
        .commandMaxReuses(commandMaxReuses)
        .connectTimeout(connectTimeout)
        .requestTimeout(requestTimeout)
        .reconnectDelay(reconnectDelay)
        .maxReconnectAttempts(maxReconnectAttempts)
        .build();
  }

  /** Backend process launched per session. */
  @Data
  public static class Backend {

    /** Executable resolved against {@code PATH}. */
    private String executable = ProcessSessionChannelFactory.DEFAULT_EXECUTABLE;

    /** Appended to every command line (tool restrictions, permission mode). */
    private List<String> extraArguments = new ArrayList<>();

    /** Bound of each session's input queue. */
    private int inputCapacity = ProcessSessionChannelFactory.DEFAULT_INPUT_CAPACITY;
  }
}
