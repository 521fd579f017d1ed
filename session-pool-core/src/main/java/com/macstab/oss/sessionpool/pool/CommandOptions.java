/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.pool;

import java.time.Duration;

import lombok.Builder;
import lombok.Value;

/** Per-call options for {@link CommandPool#sendPrompt(String, CommandOptions)}. */
@Value
@Builder
public class CommandOptions {

  public static final CommandOptions NONE = CommandOptions.builder().build();

  /** Gives up on the reply after this long and recycles the slot; {@code null} waits forever. */
  Duration timeout;

  public static CommandOptions withTimeout(final Duration timeout) {
    return CommandOptions.builder().timeout(timeout).build();
  }
}
