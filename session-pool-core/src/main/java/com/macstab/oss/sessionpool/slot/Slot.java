/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.slot;

import java.util.concurrent.CompletableFuture;

import com.macstab.oss.sessionpool.channel.SessionChannel;

/**
 * Mutable state of one pool slot.
 *
 * <p><strong>Confinement:</strong> every field is read and written on the owning pool's event loop
 * only. No field is volatile and no method synchronizes.
 *
 * <p><strong>Generation:</strong> bumped on every recycle and kill. A stream consumer captures the
 * generation it was started under and drops everything once the slot has moved on, so a late event
 * from a replaced session can never reach a newer request.
 */
final class Slot {

  final int index;

  SlotState state = SlotState.DEAD;
  SessionChannel channel;

  /** Completed by the stream consumer with the next result; {@code null} when nobody waits. */
  CompletableFuture<SessionResult> pendingResult;

  /** Completed with the warm-up verdict; non-null only while a warm-up is outstanding. */
  CompletableFuture<Boolean> warmupVerdict;

  int reuseCount;
  int generation;
  long dispatchedAt;

  long lastRecycleTime;
  int rapidRecycleCount;

  Slot(final int index) {
    this.index = index;
  }

  void resetPendingResult() {
    pendingResult = new CompletableFuture<>();
  }

  void deliver(final SessionResult result) {
    if (pendingResult != null) {
      pendingResult.complete(result);
    }
  }

  void resolveWarmup(final boolean ok) {
    final var verdict = warmupVerdict;
    warmupVerdict = null;
    if (verdict != null) {
      verdict.complete(ok);
    }
  }

  void closeChannel() {
    final var current = channel;
    channel = null;
    if (current != null) {
      current.close();
    }
  }

  /** Closes the session and releases any caller still waiting on it with an empty result. */
  void teardown() {
    closeChannel();
    deliver(SessionResult.EMPTY);
    pendingResult = null;
    reuseCount = 0;
  }

  void resetCircuitBreaker() {
    rapidRecycleCount = 0;
    lastRecycleTime = 0;
  }

  @Override
  public String toString() {
    return String.format("Slot[%d, %s, gen=%d, reuses=%d]", index, state, generation, reuseCount);
  }
}
