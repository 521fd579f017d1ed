/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.channel;

import java.nio.file.Path;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** Everything a {@link SessionChannelFactory} needs to launch one backend session. */
@Value
@Builder
public class SessionSpec {

  /** Pool label, used for thread names and log lines. */
  @NonNull String label;

  int slotIndex;

  @NonNull String model;

  @NonNull String systemPrompt;

  /** Working directory of the backend process; {@code null} inherits the host's. */
  Path workingDirectory;
}
