/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.ipc;

import com.macstab.oss.sessionpool.slot.PoolStats;

import lombok.Builder;
import lombok.Value;

/** Status as seen from one process: its own role plus the server's view of both pools. */
@Value
@Builder
public class PoolStatus {
  PoolRole role;
  String model;
  boolean completionPoolAvailable;
  boolean commandPoolAvailable;
  int connectedClients;
  PoolStats completionPool;
  PoolStats commandPool;
}
