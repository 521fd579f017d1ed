/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.slot;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Point-in-time statistics of one pool, as reported by the status request.
 *
 * <p>Token counters are cumulative since activation and include warm-up turns. {@code activatedAt}
 * and {@code lastRequestAt} are epoch milliseconds, {@code null} until the event happened.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PoolStats {
  String label;
  boolean available;
  Long activatedAt;
  long uptimeMs;
  long totalRequests;
  long totalRecycles;
  Long lastRequestAt;
  long totalInputTokens;
  long totalOutputTokens;
  long totalCacheReadTokens;
  long totalCacheCreationTokens;
  double totalCostUsd;
  @Singular List<SlotStats> slots;
}
