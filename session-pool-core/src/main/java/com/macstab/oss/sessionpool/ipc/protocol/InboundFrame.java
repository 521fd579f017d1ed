/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.ipc.protocol;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/** A decoded server-to-client frame: exactly one of {@code response} and {@code event} is set. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InboundFrame {

  PoolResponse response;
  ServerEvent event;

  public static InboundFrame of(final PoolResponse response) {
    return new InboundFrame(response, null);
  }

  public static InboundFrame of(final ServerEvent event) {
    return new InboundFrame(null, event);
  }

  public boolean isEvent() {
    return event != null;
  }
}
