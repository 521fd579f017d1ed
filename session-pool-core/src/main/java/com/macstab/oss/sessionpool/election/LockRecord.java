/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.election;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Content of the leader lockfile: owning process id and acquisition time (epoch millis). */
@Value
@Builder
@Jacksonized
public class LockRecord {
  long pid;
  long timestamp;
}
