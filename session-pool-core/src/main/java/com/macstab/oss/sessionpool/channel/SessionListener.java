/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.channel;

/**
 * Receives the output side of a {@link SessionChannel}.
 *
 * <p>Callbacks arrive on the channel's I/O thread. Implementations must hand work off rather than
 * block it; the pool engine re-posts every callback onto its own event loop.
 *
 * <p>After {@link #onError(Throwable)} or {@link #onClosed()} the channel delivers nothing further
 * of its own accord, but a listener must still tolerate late events (a channel may race its own
 * close).
 */
public interface SessionListener {

  void onEvent(SessionEvent event);

  void onError(Throwable error);

  /** End of stream: the backend exited or the channel was closed. */
  void onClosed();
}
