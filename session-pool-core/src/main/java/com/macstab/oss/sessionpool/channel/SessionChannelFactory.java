/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.channel;

import java.io.IOException;

/**
 * Opens backend sessions for the pool engine.
 *
 * <p>The production implementation is {@link ProcessSessionChannelFactory}. Tests plug in scripted
 * factories that answer pushes without spawning processes.
 */
public interface SessionChannelFactory {

  /**
   * Launches a session and wires its output to {@code listener}.
   *
   * @throws IOException if the backend cannot be started
   */
  SessionChannel open(SessionSpec spec, SessionListener listener) throws IOException;

  /**
   * Probes whether sessions can be opened at all (e.g. the backend executable exists).
   *
   * <p>Pools call this once on activation and again on restart. A {@code false} answer leaves the
   * pool unavailable without touching any slot.
   */
  default boolean isAvailable() {
    return true;
  }
}
