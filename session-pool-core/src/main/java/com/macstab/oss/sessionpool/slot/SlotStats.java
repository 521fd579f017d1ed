/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.slot;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Point-in-time view of one slot. */
@Value
@Builder
@Jacksonized
public class SlotStats {
  SlotState state;
  int requestCount;
  int maxRequests;
}
