/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.sessionpool.channel;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Usage metadata reported by the backend alongside a result.
 *
 * <p>Values the backend does not report default to zero. {@code model} is filled in by the pool
 * that served the request, the backend itself does not echo it.
 */
@Value
@With
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResultMetadata {

  public static final ResultMetadata NONE = ResultMetadata.builder().build();

  String model;
  long durationMs;
  long durationApiMs;
  double costUsd;
  long inputTokens;
  long outputTokens;
  long cacheReadTokens;
  long cacheCreationTokens;
  String sessionId;
}
