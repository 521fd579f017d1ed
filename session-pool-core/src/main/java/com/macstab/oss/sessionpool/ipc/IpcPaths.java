/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.ipc;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Filesystem locations shared by every cooperating process of one user.
 *
 * <p>Defaults to {@code ~/.session-pool/pool.sock} (Unix domain socket) and {@code
 * ~/.session-pool/pool.lock} (leader lockfile). Unix domain socket paths are limited to roughly 100
 * bytes on most platforms, so custom state directories should stay short.
 */
@Slf4j
@Value
public class IpcPaths {

  public static final String DEFAULT_DIRECTORY_NAME = ".session-pool";
  public static final String SOCKET_FILE_NAME = "pool.sock";
  public static final String LOCK_FILE_NAME = "pool.lock";

  Path stateDirectory;
  Path socketPath;
  Path lockPath;

  public static IpcPaths under(@NonNull final Path stateDirectory) {
    return new IpcPaths(
        stateDirectory,
        stateDirectory.resolve(SOCKET_FILE_NAME),
        stateDirectory.resolve(LOCK_FILE_NAME));
  }

  public static IpcPaths defaults() {
    return under(Path.of(System.getProperty("user.home"), DEFAULT_DIRECTORY_NAME));
  }

  public void ensureStateDirectory() throws IOException {
    Files.createDirectories(stateDirectory);
  }

  public boolean endpointExists() {
    return Files.exists(socketPath);
  }

  /** Removes a socket file left behind by a dead server. Failures are logged, never thrown. */
  public void removeEndpoint() {
    try {
      if (Files.deleteIfExists(socketPath)) {
        log.debug("Removed socket file {}", socketPath);
      }
    } catch (final IOException e) {
      log.warn("Failed to remove socket file {}: {}", socketPath, e.getMessage());
    }
  }
}
