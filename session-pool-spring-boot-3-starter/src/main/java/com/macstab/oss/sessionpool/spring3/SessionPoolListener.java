/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.spring3;

import com.macstab.oss.sessionpool.ipc.PoolRole;
import com.macstab.oss.sessionpool.ipc.protocol.PoolKind;

/**
 * Callback bean for pool client events. Every bean of this type in the context is notified, in
 * {@code @Order} order.
 *
 * <p>Callbacks run on the client's coordinator or reader thread and must not block.
 */
public interface SessionPoolListener {

  default void onRoleChange(PoolRole role) {
    // No-op by default
  }

  /** The completion or command pool became permanently unavailable until the next restart. */
  default void onPoolDegraded(PoolKind pool) {
    // No-op by default
  }
}
