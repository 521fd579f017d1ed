/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.channel;

/**
 * Bounded, push-based conduit to one backend session.
 *
 * <p><strong>Ownership:</strong> a channel belongs to exactly one slot while that slot holds it.
 * Closing it terminates the backend process; nobody but the owning pool may call {@link #close()}.
 *
 * <p><strong>Bounded input:</strong> {@link #push(String)} never blocks. When the input queue is
 * full or the channel is closed it throws {@link IllegalStateException}, which the pool treats as a
 * stream failure.
 */
public interface SessionChannel extends AutoCloseable {

  /**
   * Enqueues one user message for the backend.
   *
   * @throws IllegalStateException if the channel is closed or its input queue is full
   */
  void push(String message);

  boolean isOpen();

  /** Idempotent. Terminates the backend process. */
  @Override
  void close();
}
