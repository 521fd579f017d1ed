/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.slot;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle state of one pool slot.
 *
 * <pre>
 * INITIALIZING --warm-up ok--> AVAILABLE --acquire--> BUSY --result, below limit--> AVAILABLE
 *      ^                                               |
 *      +------------------ recycle --------------------+
 * any --kill / circuit breaker--> DEAD
 * </pre>
 */
public enum SlotState {
  INITIALIZING,
  AVAILABLE,
  BUSY,
  DEAD;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
